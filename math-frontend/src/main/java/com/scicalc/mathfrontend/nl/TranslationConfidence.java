package com.scicalc.mathfrontend.nl;

import com.scicalc.mathfrontend.engine.MathOperation;

/**
 * Rough 0.0 to 1.0 score of how sure the translator is about a translation.
 */
public final class TranslationConfidence {

    private static final double PASSTHROUGH = 0.3;
    private static final double TRANSLATED = 0.6;
    private static final double OPERATION_BONUS = 0.2;
    private static final double VARIABLE_BONUS = 0.1;

    private TranslationConfidence() {
    }

    public static double score(NLTranslation translation) {
        if (translation == null || translation.getExpression().isEmpty()) {
            return 0.0;
        }
        if (!translation.isDidTranslate()) {
            return PASSTHROUGH;
        }
        double score = TRANSLATED;
        if (translation.getOperation() != MathOperation.EVALUATE) {
            score += OPERATION_BONUS;
        }
        if (translation.getVariable() != null) {
            score += VARIABLE_BONUS;
        }
        return Math.min(1.0, score);
    }
}
