package me.christianrobert.arclabel.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.arclabel.config.service.ConfigService;
import me.christianrobert.arclabel.core.tools.HtmlEntityDecoder;
import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.arcade.ArcadeExpressionTranslator;
import me.christianrobert.arclabel.transformer.builder.DomainCaseExpressionBuilder;
import me.christianrobert.arclabel.transformer.context.TransformationException;
import me.christianrobert.arclabel.transformer.context.TransformationResult;
import me.christianrobert.arclabel.transformer.model.ExpressionEngine;
import me.christianrobert.arclabel.transformer.model.LabelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers that hold whole label classes rather than raw VBScript.
 *
 * <p>Dispatches on the expression engine:</p>
 * <ul>
 *   <li><strong>VBScript</strong> (also when no engine is given) - {@link LabelExpressionService}</li>
 *   <li><strong>Arcade</strong> - {@link ArcadeExpressionTranslator}</li>
 *   <li><strong>Python / JScript</strong> - only a bare field name can be carried over</li>
 * </ul>
 *
 * <p>Also builds the expressions that do not come from label code: coded-value domain lookups
 * and layer display fields.</p>
 */
@ApplicationScoped
public class LabelTransformationService {

    private static final Logger log = LoggerFactory.getLogger(LabelTransformationService.class);

    @Inject
    LabelExpressionService labelExpressionService;

    @Inject
    ConfigService configService;

    /**
     * Transforms one label class. Never throws.
     *
     * @return Result tagged with the label class name
     */
    public TransformationResult transform(LabelDefinition definition) {
        if (definition == null) {
            return TransformationResult.failure(null, "Label definition cannot be null");
        }

        String engineName = definition.getEngine();
        ExpressionEngine engine = engineName == null || engineName.trim().isEmpty()
                ? ExpressionEngine.VBSCRIPT
                : ExpressionEngine.fromName(engineName);

        TransformationResult result;
        if (engine == null) {
            log.warn("Unknown expression engine '{}' for label '{}'", engineName, definition.getName());
            result = TransformationResult.failure(definition.getExpression(),
                    "Unknown expression engine: " + engineName);
        } else {
            log.debug("Transforming label '{}' with engine {}", definition.getName(), engine.getDisplayName());
            result = switch (engine) {
                case VBSCRIPT -> labelExpressionService.transform(definition.getExpression());
                case ARCADE -> transformArcade(definition.getExpression());
                case PYTHON, JSCRIPT -> transformFieldOnly(definition.getExpression(), engine);
            };
        }
        return result.withLabelName(definition.getName());
    }

    /**
     * Transforms label classes independently; a failing definition does not affect the others.
     *
     * @return One result per definition, in input order
     */
    public List<TransformationResult> transformAll(List<LabelDefinition> definitions) {
        List<TransformationResult> results = new ArrayList<>(definitions.size());
        int failed = 0;

        for (LabelDefinition definition : definitions) {
            TransformationResult result;
            try {
                result = transform(definition);
            } catch (RuntimeException e) {
                log.error("Unexpected error transforming label '{}'",
                        definition != null ? definition.getName() : null, e);
                result = TransformationResult.failure(definition != null ? definition.getExpression() : null,
                        "Unexpected error: " + e.getMessage());
            }
            if (result.isFailure()) {
                failed++;
            }
            results.add(result);
        }

        log.info("Transformed {} label definitions: {} succeeded, {} failed",
                definitions.size(), definitions.size() - failed, failed);
        return results;
    }

    /**
     * Builds the lookup expression that labels features with the description of their coded value.
     *
     * @param fieldName Field carrying the codes
     * @param codedValues Code → description, in display order
     * @return CASE expression, or null when the domain has no values
     */
    public String transformDomain(String fieldName, Map<String, String> codedValues) {
        if (fieldName == null || fieldName.trim().isEmpty()) {
            throw new IllegalArgumentException("Field name cannot be null or empty");
        }
        String expression = DomainCaseExpressionBuilder.build(fieldName.trim(), codedValues,
                configService.isPrettyPrint());
        if (expression == null) {
            log.debug("No coded values for field '{}', no domain expression built", fieldName);
        }
        return expression;
    }

    /**
     * Display expression for a layer whose display field is {@code fieldName}.
     */
    public String displayFieldExpression(String fieldName) {
        if (fieldName == null || fieldName.trim().isEmpty()) {
            return null;
        }
        return QgisExpressionUtils.fieldReference(fieldName.trim());
    }

    private TransformationResult transformArcade(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            return TransformationResult.failure(expression, "Label expression cannot be null or empty");
        }
        try {
            String qgis = ArcadeExpressionTranslator.translate(HtmlEntityDecoder.decode(expression),
                    configService.isPrettyPrint());
            return TransformationResult.success(expression, qgis, TransformationResult.InputKind.EXPRESSION);
        } catch (TransformationException e) {
            log.warn("Arcade transformation failed: {}", e.getDetailedMessage());
            return TransformationResult.failure(expression, e);
        }
    }

    private TransformationResult transformFieldOnly(String expression, ExpressionEngine engine) {
        if (expression != null && labelExpressionService.isBareFieldName(HtmlEntityDecoder.decode(expression))) {
            return labelExpressionService.transform(expression);
        }
        log.warn("{} label expressions are not supported", engine.getDisplayName());
        return TransformationResult.failure(expression, new TransformationException(
                TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                engine.getDisplayName() + " label expressions are not supported; only a plain field name can be converted"));
    }
}
