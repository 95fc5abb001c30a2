package com.example.careplan.journey.service;

import com.example.careplan.journey.model.Requirement;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses requirement strings such as {@code gcp:complete}, {@code gcp:progress>=0.5} and
 * {@code flag:fall_risk|cognitive_risk}.
 */
@Component
public class RequirementParser {

    private static final String ID = "[a-z][a-z0-9_]*";
    private static final Pattern COMPLETE = Pattern.compile("^(" + ID + "):complete$");
    private static final Pattern PROGRESS = Pattern.compile("^(" + ID + "):progress>=(\\d+(?:\\.\\d+)?)$");
    private static final Pattern FLAGS = Pattern.compile("^flag:(" + ID + "(?:\\|" + ID + ")*)$");

    /**
     * @throws IllegalArgumentException if the string matches no known form
     */
    @NonNull
    public Requirement parse(@NonNull String raw) {
        String value = raw.trim();

        Matcher flags = FLAGS.matcher(value);
        if (flags.matches()) {
            Set<String> ids = Arrays.stream(flags.group(1).split("\\|")).collect(Collectors.toSet());
            return new Requirement.AnyFlag(ids);
        }

        Matcher complete = COMPLETE.matcher(value);
        if (complete.matches()) {
            return new Requirement.ProductComplete(complete.group(1));
        }

        Matcher progress = PROGRESS.matcher(value);
        if (progress.matches()) {
            BigDecimal fraction = new BigDecimal(progress.group(2));
            if (fraction.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("Progress requirement above 1.0: " + raw);
            }
            return new Requirement.ProgressAtLeast(progress.group(1), fraction);
        }

        throw new IllegalArgumentException("Malformed unlock requirement: '" + raw + "'");
    }
}
