package io.github.sachinnimbal.filmes.dto;

import io.github.sachinnimbal.filmes.core.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Sparse update of a movie. Only fields the client actually sent are {@link PatchField#isPresent() present};
 * a present field is applied even when its value is null or empty.
 */
@Getter
@Builder
@ToString
public class MoviePatch {

    public static final String TITLE = "title";
    public static final String GENRE = "genre";
    public static final String DURATION_MINUTES = "durationMinutes";
    public static final String DIRECTOR = "director";
    public static final String DESCRIPTION = "description";

    private static final Set<String> SERVER_OWNED_FIELDS =
            Set.of("id", "createdAt", "updatedAt", "lengthCategory", "runtime");

    @Builder.Default
    private final PatchField<String> title = PatchField.absent();
    @Builder.Default
    private final PatchField<String> genre = PatchField.absent();
    @Builder.Default
    private final PatchField<Integer> durationMinutes = PatchField.absent();
    @Builder.Default
    private final PatchField<String> director = PatchField.absent();
    @Builder.Default
    private final PatchField<String> description = PatchField.absent();

    /**
     * Builds a patch from a decoded JSON object. Key presence, not value, marks a field as present.
     *
     * @throws ValidationException for an empty body, unknown or server-owned fields, or values of the wrong type
     */
    public static MoviePatch from(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new ValidationException("Update data cannot be null or empty");
        }

        Map<String, String> errors = new LinkedHashMap<>();
        MoviePatchBuilder builder = MoviePatch.builder();

        updates.forEach((field, value) -> {
            switch (field) {
                case TITLE -> textField(field, value, errors, builder::title);
                case GENRE -> textField(field, value, errors, builder::genre);
                case DIRECTOR -> textField(field, value, errors, builder::director);
                case DESCRIPTION -> textField(field, value, errors, builder::description);
                case DURATION_MINUTES -> wholeNumberField(field, value, errors, builder::durationMinutes);
                default -> errors.put(field, SERVER_OWNED_FIELDS.contains(field)
                        ? "cannot be updated"
                        : "does not exist");
            }
        });

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid patch: " + String.join(", ", errors.keySet()), errors);
        }
        return builder.build();
    }

    public boolean isEmpty() {
        return presentFields().isEmpty();
    }

    public List<String> presentFields() {
        List<String> fields = new ArrayList<>();
        if (title.isPresent()) fields.add(TITLE);
        if (genre.isPresent()) fields.add(GENRE);
        if (durationMinutes.isPresent()) fields.add(DURATION_MINUTES);
        if (director.isPresent()) fields.add(DIRECTOR);
        if (description.isPresent()) fields.add(DESCRIPTION);
        return fields;
    }

    private static void textField(String field, Object value, Map<String, String> errors,
                                  Function<PatchField<String>, MoviePatchBuilder> setter) {
        if (value == null || value instanceof String) {
            setter.apply(PatchField.of((String) value));
        } else {
            errors.put(field, "must be a string");
        }
    }

    private static void wholeNumberField(String field, Object value, Map<String, String> errors,
                                         Function<PatchField<Integer>, MoviePatchBuilder> setter) {
        if (value == null) {
            setter.apply(PatchField.of(null));
            return;
        }
        if (!(value instanceof Number)) {
            errors.put(field, "must be a number");
            return;
        }
        // JSON integers decode to Integer, Long or BigInteger; anything else had a fraction or exponent
        if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger)) {
            errors.put(field, "must be a whole number");
            return;
        }
        try {
            setter.apply(PatchField.of(new BigInteger(value.toString()).intValueExact()));
        } catch (ArithmeticException e) {
            errors.put(field, "must be a whole number");
        }
    }
}
