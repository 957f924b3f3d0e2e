package com.carepilot.orchestrator.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Image bytes attached at run start (typically a chest X-ray).
 *
 * The array is copied on the way in and on the way out so that no caller can
 * mutate the bytes a stage is classifying.
 */
public record MedicalImage(byte[] data, String filename) {

    public MedicalImage {
        Objects.requireNonNull(data, "data");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MedicalImage other
            && Arrays.equals(data, other.data)
            && Objects.equals(filename, other.filename);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + Objects.hashCode(filename);
    }

    @Override
    public String toString() {
        return "MedicalImage[filename=" + filename + ", bytes=" + data.length + "]";
    }
}
