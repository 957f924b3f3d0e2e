package com.carepilot.orchestrator.vision;

import com.carepilot.orchestrator.model.MedicalImage;
import org.springframework.stereotype.Component;

/**
 * Cheap local checks on an attached image before it is sent for classification.
 *
 * Accepts PNG, JPEG and DICOM (Part 10, "DICM" preamble marker) by signature
 * and rejects empty or oversized payloads. Runs during the Imaging stage's
 * preparation, concurrently with knowledge retrieval.
 */
@Component
public class ImagePreValidator {

    /** Upper bound on accepted image size. */
    static final int MAX_BYTES = 20 * 1024 * 1024;

    private static final byte[] PNG_SIGNATURE  = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final byte[] JPEG_SIGNATURE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] DICOM_MARKER   = {'D', 'I', 'C', 'M'};
    private static final int    DICOM_OFFSET   = 128;

    public enum Format { PNG, JPEG, DICOM }

    /**
     * @return the detected format
     * @throws ClassifierException with kind UNSUPPORTED_FORMAT if the image is unusable
     */
    public Format validate(MedicalImage image) {
        if (image == null || image.size() == 0) {
            throw new ClassifierException(ClassifierException.Kind.UNSUPPORTED_FORMAT, "Image is empty");
        }
        if (image.size() > MAX_BYTES) {
            throw new ClassifierException(ClassifierException.Kind.UNSUPPORTED_FORMAT,
                    "Image is " + image.size() + " bytes, limit is " + MAX_BYTES);
        }
        byte[] data = image.data();
        if (startsWith(data, 0, PNG_SIGNATURE))            return Format.PNG;
        if (startsWith(data, 0, JPEG_SIGNATURE))           return Format.JPEG;
        if (startsWith(data, DICOM_OFFSET, DICOM_MARKER))  return Format.DICOM;
        throw new ClassifierException(ClassifierException.Kind.UNSUPPORTED_FORMAT,
                "Unrecognised image signature" + (image.filename() == null ? "" : " for " + image.filename()));
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length < offset + prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) return false;
        }
        return true;
    }
}
