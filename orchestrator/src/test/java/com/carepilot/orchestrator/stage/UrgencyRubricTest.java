package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.UrgencyLevel;
import org.junit.jupiter.api.Test;

import static com.carepilot.orchestrator.CaseFixtures.CHEST_CASE;
import static com.carepilot.orchestrator.CaseFixtures.MILD_COUGH;
import static org.assertj.core.api.Assertions.assertThat;

class UrgencyRubricTest {

    @Test
    void mildSeasonalCough_isLow() {
        UrgencyRubric.Assessment a = UrgencyRubric.assess(MILD_COUGH);

        assertThat(a.basis()).isEqualTo(UrgencyRubric.Basis.MITIGATING);
        assertThat(a.level()).isEqualTo(UrgencyLevel.LOW);
        assertThat(a.matchedTerms()).isEmpty();
    }

    @Test
    void negatedFever_doesNotCountAsFever() {
        assertThat(UrgencyRubric.assess("no fever, just tired").level()).isEqualTo(UrgencyLevel.LOW);
    }

    @Test
    void feverChestPainBreathlessness_isAtLeastHigh() {
        UrgencyRubric.Assessment a = UrgencyRubric.assess(CHEST_CASE);

        assertThat(a.basis()).isEqualTo(UrgencyRubric.Basis.SEVERITY);
        assertThat(a.level()).isGreaterThanOrEqualTo(UrgencyLevel.HIGH);
        assertThat(a.matchedTerms()).contains("chest pain", "shortness of breath", "high fever");
    }

    @Test
    void singleHighTerm_isHigh() {
        assertThat(UrgencyRubric.assess("sudden chest pain after climbing stairs").level())
                .isEqualTo(UrgencyLevel.HIGH);
    }

    @Test
    void criticalTerm_winsOverMitigatingWords() {
        assertThat(UrgencyRubric.assess("mild headache then a seizure").level())
                .isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void longerCriticalPhrase_isNotAlsoCountedAsHigh() {
        UrgencyRubric.Assessment a = UrgencyRubric.assess("crushing chest pain");

        assertThat(a.level()).isEqualTo(UrgencyLevel.CRITICAL);
        assertThat(a.matchedTerms()).containsExactly("crushing chest pain");
    }

    @Test
    void moderateTerms_areModerate() {
        assertThat(UrgencyRubric.assess("Fever and vomiting since yesterday").level())
                .isEqualTo(UrgencyLevel.MODERATE);
    }

    @Test
    void partialWords_doNotMatch() {
        assertThat(UrgencyRubric.assess("feverish feeling").basis()).isEqualTo(UrgencyRubric.Basis.NONE);
    }

    @Test
    void unknownComplaint_isNotDecisive() {
        UrgencyRubric.Assessment a = UrgencyRubric.assess("itchy left ear");

        assertThat(a.basis()).isEqualTo(UrgencyRubric.Basis.NONE);
        assertThat(UrgencyRubric.assess("").basis()).isEqualTo(UrgencyRubric.Basis.NONE);
        assertThat(a.apply(UrgencyLevel.MODERATE)).isEqualTo(UrgencyLevel.MODERATE);
    }

    // ------------------------------------------------------------------
    // Combining with the model's level
    // ------------------------------------------------------------------

    @Test
    void severityMatch_isAFloorUnderTheModel() {
        UrgencyRubric.Assessment high = UrgencyRubric.assess("sudden chest pain after climbing stairs");

        assertThat(high.apply(UrgencyLevel.LOW)).isEqualTo(UrgencyLevel.HIGH);
        assertThat(high.apply(UrgencyLevel.HIGH)).isEqualTo(UrgencyLevel.HIGH);
        assertThat(high.apply(UrgencyLevel.CRITICAL)).isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void mitigatingOnly_decidesBetweenLowAndModerate() {
        UrgencyRubric.Assessment mild = UrgencyRubric.assess(MILD_COUGH);

        assertThat(mild.apply(UrgencyLevel.LOW)).isEqualTo(UrgencyLevel.LOW);
        assertThat(mild.apply(UrgencyLevel.MODERATE)).isEqualTo(UrgencyLevel.LOW);
        assertThat(mild.apply(UrgencyLevel.HIGH)).isEqualTo(UrgencyLevel.HIGH);
        assertThat(mild.apply(UrgencyLevel.CRITICAL)).isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void mildWordingOfUnlistedRedFlag_keepsModelCritical() {
        UrgencyRubric.Assessment a = UrgencyRubric.assess("mild slurred speech and facial droop since this morning");

        assertThat(a.basis()).isEqualTo(UrgencyRubric.Basis.MITIGATING);
        assertThat(a.apply(UrgencyLevel.CRITICAL)).isEqualTo(UrgencyLevel.CRITICAL);
    }
}
