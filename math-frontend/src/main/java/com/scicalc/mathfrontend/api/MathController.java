package com.scicalc.mathfrontend.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.engine.ComputationMode;
import com.scicalc.mathfrontend.engine.Dispatcher;
import com.scicalc.mathfrontend.engine.EvaluationContext;
import com.scicalc.mathfrontend.engine.EvaluationMetrics;
import com.scicalc.mathfrontend.engine.EvaluationReport;
import com.scicalc.mathfrontend.engine.EvaluationResult;
import com.scicalc.mathfrontend.engine.MathOperation;
import com.scicalc.mathfrontend.nl.NLTranslation;
import com.scicalc.mathfrontend.nl.NLTranslator;
import com.scicalc.mathfrontend.nl.TranslationConfidence;
import com.scicalc.mathfrontend.parser.Parser;
import com.scicalc.mathfrontend.parser.ParserException;
import com.scicalc.mathfrontend.parser.SyntaxError;
import com.scicalc.mathfrontend.parser.SyntaxValidator;
import com.scicalc.mathfrontend.symbolic.LatexFormatter;
import com.scicalc.mathfrontend.symbolic.SymbolicClient;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class MathController {

    private static final Logger log = LoggerFactory.getLogger(MathController.class);

    private final NLTranslator translator;
    private final Dispatcher dispatcher;
    private final AssistantService assistantService;
    private final SymbolicClient symbolicClient;

    public MathController(NLTranslator translator, Dispatcher dispatcher, AssistantService assistantService,
                          SymbolicClient symbolicClient) {
        this.translator = translator;
        this.dispatcher = dispatcher;
        this.assistantService = assistantService;
        this.symbolicClient = symbolicClient;
    }

    public static class TextRequest {
        private String text;

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    public static class ExpressionRequest {
        private String expression;

        public String getExpression() { return expression; }
        public void setExpression(String expression) { this.expression = expression; }
    }

    public static class EvaluateRequest {
        private String expression;
        private String mode;
        private String operation;
        private String variable;
        private Map<String, Double> variables;

        public String getExpression() { return expression; }
        public void setExpression(String expression) { this.expression = expression; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getOperation() { return operation; }
        public void setOperation(String operation) { this.operation = operation; }
        public String getVariable() { return variable; }
        public void setVariable(String variable) { this.variable = variable; }
        public Map<String, Double> getVariables() { return variables; }
        public void setVariables(Map<String, Double> variables) { this.variables = variables; }
    }

    public static class TranslateResponse {
        private final String expression;
        private final String operation;
        private final String variable;
        private final boolean translated;
        private final double confidence;

        public TranslateResponse(NLTranslation translation, double confidence) {
            this.expression = translation.getExpression();
            this.operation = translation.getOperation().label();
            this.variable = translation.getVariable();
            this.translated = translation.isDidTranslate();
            this.confidence = confidence;
        }

        public String getExpression() { return expression; }
        public String getOperation() { return operation; }
        public String getVariable() { return variable; }
        public boolean isTranslated() { return translated; }
        public double getConfidence() { return confidence; }
    }

    public static class EvaluateResponse {
        private final boolean success;
        private final String type;
        private final String result;
        private final Double value;
        private final String latex;
        private final String plainText;
        private final String error;
        private final String issue;
        private final EvaluationMetrics metrics;

        public EvaluateResponse(EvaluationReport report) {
            EvaluationResult outcome = report.getResult();
            this.success = report.isSuccess();
            this.type = outcome.getType().name();
            this.result = report.getResultString();
            this.value = outcome.getType() == EvaluationResult.Type.NUMBER ? outcome.getNumber() : null;
            this.latex = outcome.getLatex();
            this.plainText = outcome.getLatex() != null ? LatexFormatter.toPlainText(outcome.getLatex()) : null;
            this.error = outcome.getErrorMessage();
            this.issue = outcome.getIssue() != null ? outcome.getIssue().name() : null;
            this.metrics = report.getMetrics();
        }

        public boolean isSuccess() { return success; }
        public String getType() { return type; }
        public String getResult() { return result; }
        public Double getValue() { return value; }
        public String getLatex() { return latex; }
        public String getPlainText() { return plainText; }
        public String getError() { return error; }
        public String getIssue() { return issue; }
        public EvaluationMetrics getMetrics() { return metrics; }
    }

    public static class AssistantResponse {
        private final TranslateResponse translation;
        private final EvaluateResponse evaluation;

        public AssistantResponse(TranslateResponse translation, EvaluateResponse evaluation) {
            this.translation = translation;
            this.evaluation = evaluation;
        }

        public TranslateResponse getTranslation() { return translation; }
        public EvaluateResponse getEvaluation() { return evaluation; }
    }

    @PostMapping("/translate")
    public ResponseEntity<?> translate(@RequestBody TextRequest request) {
        if (request.getText() == null) {
            return badRequest("No text provided");
        }
        NLTranslation translation = translator.translate(request.getText());
        return ResponseEntity.ok(new TranslateResponse(translation, TranslationConfidence.score(translation)));
    }

    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestBody ExpressionRequest request) {
        if (request.getExpression() == null) {
            return badRequest("No expression provided");
        }
        try {
            Node ast = Parser.parse(request.getExpression());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("expression", request.getExpression());
            body.put("tree", ast.toString());
            body.put("nodeCount", ast.nodeCount());
            return ResponseEntity.ok(body);
        } catch (ParserException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("kind", e.getKind().name());
            body.put("position", e.getPosition());
            return ResponseEntity.badRequest().body(body);
        }
    }

    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody EvaluateRequest request) {
        if (request.getExpression() == null) {
            return badRequest("No expression provided");
        }
        ComputationMode mode;
        MathOperation operation;
        EvaluationContext context;
        try {
            mode = request.getMode() == null || request.getMode().isBlank()
                    ? ComputationMode.NUMERIC
                    : ComputationMode.valueOf(request.getMode().trim().toUpperCase(Locale.ROOT));
            operation = MathOperation.fromLabel(request.getOperation());
        } catch (IllegalArgumentException e) {
            return badRequest("Unknown mode or operation: " + e.getMessage());
        }
        try {
            context = EvaluationContext.withBindings(request.getVariables());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        try {
            EvaluationReport report = dispatcher.evaluate(request.getExpression(), mode, context,
                    operation, request.getVariable());
            return ResponseEntity.ok(new EvaluateResponse(report));
        } catch (RuntimeException e) {
            log.error("Error evaluating '{}'", request.getExpression(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Error: " + e.getMessage()));
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<?> validate(@RequestBody ExpressionRequest request) {
        if (request.getExpression() == null) {
            return badRequest("No expression provided");
        }
        List<SyntaxError> errors = SyntaxValidator.validate(request.getExpression());
        return ResponseEntity.ok(Map.of("valid", errors.isEmpty(), "errors", errors));
    }

    @PostMapping("/assistant")
    public ResponseEntity<?> assistant(@RequestBody TextRequest request) {
        if (request.getText() == null || request.getText().isBlank()) {
            return badRequest("No question provided");
        }
        try {
            AssistantService.Answer answer = assistantService.answer(request.getText());
            return ResponseEntity.ok(new AssistantResponse(
                    new TranslateResponse(answer.getTranslation(), answer.getConfidence()),
                    new EvaluateResponse(answer.getReport())));
        } catch (RuntimeException e) {
            log.error("Error answering '{}'", request.getText(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Error: " + e.getMessage()));
        }
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "Online");
        status.put("symbolicService", symbolicClient.getBaseUrl());
        status.put("symbolicAvailable", symbolicClient.healthCheck());
        return status;
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
