package io.github.sachinnimbal.filmes.dto;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.function.Consumer;

/**
 * A patch value together with whether the client sent it at all. A present field may hold null.
 */
@ToString
@EqualsAndHashCode
public final class PatchField<T> {

    private static final PatchField<?> ABSENT = new PatchField<>(false, null);

    private final boolean present;
    private final T value;

    private PatchField(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> PatchField<T> absent() {
        return (PatchField<T>) ABSENT;
    }

    public static <T> PatchField<T> of(T value) {
        return new PatchField<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T getValue() {
        if (!present) {
            throw new IllegalStateException("Patch field is absent");
        }
        return value;
    }

    public T orElse(T fallback) {
        return present ? value : fallback;
    }

    public void ifPresent(Consumer<? super T> action) {
        if (present) {
            action.accept(value);
        }
    }
}
