package me.christianrobert.arclabel.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.arclabel.config.service.ConfigService;
import me.christianrobert.arclabel.core.tools.CodeCleaner;
import me.christianrobert.arclabel.core.tools.HtmlEntityDecoder;
import me.christianrobert.arclabel.transformer.builder.LiteralNormalizer;
import me.christianrobert.arclabel.transformer.builder.QgisExpressionBuilder;
import me.christianrobert.arclabel.transformer.context.TransformationContext;
import me.christianrobert.arclabel.transformer.context.TransformationException;
import me.christianrobert.arclabel.transformer.context.TransformationResult;
import me.christianrobert.arclabel.transformer.parser.LineClassifier;
import me.christianrobert.arclabel.transformer.parser.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Transforms VBScript label definitions into QGIS expressions.
 *
 * <p>The input is sniffed into one of three shapes, in this order:</p>
 * <ol>
 *   <li><strong>Structured program</strong> - starts with {@code Function FindLabel} (the name is
 *       configurable), or has block keywords on their own lines. Goes through the full pipeline:
 * <pre>
 * VBScript → CodeCleaner → LineClassifier → QgisExpressionBuilder → with_variable(...) chain
 * </pre></li>
 *   <li><strong>Expression</strong> - a one-line fragment such as {@code [A] & " " & [B]}.
 *       Only literal and operator syntax is rewritten; {@code +} concatenates.</li>
 *   <li><strong>Field name</strong> - {@code [Name]} or {@code table.Name}; returned as the
 *       bare name with the "is expression" toggle off.</li>
 * </ol>
 *
 * <p>Never throws: every problem is reported as a failed {@link TransformationResult}.
 * Stateless and safe to call concurrently; each call builds its own context.</p>
 */
@ApplicationScoped
public class LabelExpressionService {

    private static final Logger log = LoggerFactory.getLogger(LabelExpressionService.class);

    private static final Pattern BARE_FIELD = Pattern.compile("^\\[?[^\\s\\[\\]\"'&+<>=()]+]?$");
    private static final Pattern BLOCK_KEYWORD_LINE = Pattern.compile(
            "^\\s*(If\\s.*\\sThen\\s*$|Select\\s+Case\\s|End\\s+(If|Select|Function)\\s*$)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    @Inject
    ConfigService configService;

    /**
     * Transforms a label definition of any of the three shapes.
     *
     * @param labelText Raw definition text (may contain HTML entities)
     * @return Result with the QGIS expression and the "is expression" toggle, or the error
     */
    public TransformationResult transform(String labelText) {
        if (labelText == null || labelText.trim().isEmpty()) {
            return TransformationResult.failure(labelText, "Label expression cannot be null or empty");
        }

        String decoded = HtmlEntityDecoder.decode(labelText).trim();
        log.trace("Label expression: {}", decoded);

        try {
            if (isStructuredProgram(decoded)) {
                return TransformationResult.success(labelText, transformProgramText(decoded),
                        TransformationResult.InputKind.STRUCTURED_PROGRAM);
            }

            if (!isBareFieldName(decoded)) {
                log.debug("Transforming single-line label expression");
                String qgis = LiteralNormalizer.normalizeExpression(decoded);
                return TransformationResult.success(labelText, qgis, TransformationResult.InputKind.EXPRESSION);
            }

            log.debug("Label expression is a bare field name");
            return TransformationResult.success(labelText, stripFieldName(decoded),
                    TransformationResult.InputKind.FIELD_NAME);

        } catch (TransformationException e) {
            log.warn("Label transformation failed: {}", e.getDetailedMessage());
            return TransformationResult.failure(labelText, e);

        } catch (RuntimeException e) {
            log.error("Unexpected error during label transformation", e);
            return TransformationResult.failure(labelText, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Transforms text that is known to be a structured label program.
     *
     * @param program VBScript program, with or without the Function wrapper
     * @return Result with the nested with_variable expression, or the error
     */
    public TransformationResult transformProgram(String program) {
        if (program == null || program.trim().isEmpty()) {
            return TransformationResult.failure(program, "Label program cannot be null or empty");
        }
        try {
            String qgis = transformProgramText(HtmlEntityDecoder.decode(program));
            return TransformationResult.success(program, qgis, TransformationResult.InputKind.STRUCTURED_PROGRAM);
        } catch (TransformationException e) {
            log.warn("Label program transformation failed: {}", e.getDetailedMessage());
            return TransformationResult.failure(program, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error during label program transformation", e);
            return TransformationResult.failure(program, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * True for {@code Name}, {@code [Name]} and {@code table.Name}: no whitespace, no literal,
     * no operator.
     */
    public boolean isBareFieldName(String text) {
        return text != null && BARE_FIELD.matcher(text.trim()).matches();
    }

    boolean isStructuredProgram(String text) {
        Pattern header = Pattern.compile("^Function\\s+" + Pattern.quote(configService.getFunctionName()) + "\\b",
                Pattern.CASE_INSENSITIVE);
        return header.matcher(text).find() || BLOCK_KEYWORD_LINE.matcher(text).find();
    }

    private String transformProgramText(String program) {
        // STEP 1: Remove comments
        log.debug("Step 1: Removing comments");
        String cleaned = CodeCleaner.removeComments(program);

        // STEP 2: Classify statements
        log.debug("Step 2: Classifying statements");
        List<SourceLine> lines = new LineClassifier().classify(cleaned);

        // STEP 3: Build the binding chain
        log.debug("Step 3: Building QGIS expression");
        TransformationContext context = new TransformationContext(configService.getFunctionName(),
                configService.isPrettyPrint());
        String qgis = new QgisExpressionBuilder(context, lines).build();

        log.info("Transformed label program with target variable '{}' ({} initial assignments)",
                context.getTargetVariable(), context.getInitialAssignments().size());
        log.debug("QGIS expression: {}", qgis);
        return qgis;
    }

    private static String stripFieldName(String text) {
        String name = text.replace("[", "").replace("]", "");
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
