package com.stagewise.engine.navigation;

import com.stagewise.engine.api.model.definition.FieldRequirement;
import com.stagewise.engine.compiler.model.ExperimentNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a submitted payload against the field requirements of its unit.
 * Disabled fields are ignored; patterns must match the whole value.
 */
final class SubmissionValidator {

    private static final Logger logger = Logger.getLogger(SubmissionValidator.class.getName());

    private final ConcurrentMap<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * @return one message per failing field, empty when the payload is valid
     */
    List<String> validate(ExperimentNode unit, Map<String, Object> payload) {
        List<String> errors = new ArrayList<>();
        for (FieldRequirement requirement : unit.fields()) {
            if (!requirement.enabled()) {
                continue;
            }
            Object value = payload.get(requirement.field());
            if (isBlank(value)) {
                if (requirement.required()) {
                    errors.add("Field '" + requirement.field() + "' is required");
                }
                continue;
            }
            if (requirement.validation() != null && !matches(requirement.validation(), value)) {
                errors.add("Field '" + requirement.field() + "': " + requirement.validationMessage());
            }
        }
        return errors;
    }

    private boolean matches(String regex, Object value) {
        Pattern pattern;
        try {
            pattern = patterns.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            logger.warning("Ignoring invalid validation pattern '" + regex + "': " + e.getDescription());
            return true;
        }
        return pattern.matcher(String.valueOf(value)).matches();
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        return value instanceof Collection<?> collection && collection.isEmpty();
    }
}
