package com.scicalc.mathfrontend.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.scicalc.mathfrontend.engine.ComputationMode;
import com.scicalc.mathfrontend.engine.Dispatcher;
import com.scicalc.mathfrontend.engine.EvaluationContext;
import com.scicalc.mathfrontend.engine.EvaluationReport;
import com.scicalc.mathfrontend.engine.MathOperation;
import com.scicalc.mathfrontend.nl.NLTranslation;
import com.scicalc.mathfrontend.nl.NLTranslator;
import com.scicalc.mathfrontend.nl.TranslationConfidence;

/**
 * Answers a question typed in English: translate it, then evaluate the expression.
 * Anything other than plain evaluation goes straight to the symbolic engine.
 */
@Service
public class AssistantService {

    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    private final NLTranslator translator;
    private final Dispatcher dispatcher;

    public AssistantService(NLTranslator translator, Dispatcher dispatcher) {
        this.translator = translator;
        this.dispatcher = dispatcher;
    }

    public Answer answer(String text) {
        NLTranslation translation = translator.translate(text);
        double confidence = TranslationConfidence.score(translation);
        log.info("Assistant: '{}' -> '{}' ({}, confidence {})", text, translation.getExpression(),
                translation.getOperation().label(), confidence);

        ComputationMode mode = translation.getOperation() == MathOperation.EVALUATE
                ? ComputationMode.NUMERIC : ComputationMode.SYMBOLIC;
        EvaluationReport report = dispatcher.evaluate(translation.getExpression(), mode,
                EvaluationContext.empty(), translation.getOperation(), translation.getVariable());
        return new Answer(translation, confidence, report);
    }

    public static class Answer {
        private final NLTranslation translation;
        private final double confidence;
        private final EvaluationReport report;

        public Answer(NLTranslation translation, double confidence, EvaluationReport report) {
            this.translation = translation;
            this.confidence = confidence;
            this.report = report;
        }

        public NLTranslation getTranslation() { return translation; }
        public double getConfidence() { return confidence; }
        public EvaluationReport getReport() { return report; }
    }
}
