package cn.bitsleep.taskrush.service;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One attribute of a partial update: either absent (leave the stored value alone) or
 * present with a value, which may itself be {@code null} ("clear this field").
 */
@EqualsAndHashCode
@ToString
public final class FieldPatch<T> {

    private final boolean present;
    private final T value;

    private FieldPatch(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    public static <T> FieldPatch<T> absent() {
        return new FieldPatch<>(false, null);
    }

    public static <T> FieldPatch<T> of(T value) {
        return new FieldPatch<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T get() {
        if (!present) throw new NoSuchElementException("Field not supplied");
        return value;
    }

    /** Transforms a present value (null included); an absent patch stays absent. */
    public <R> FieldPatch<R> map(Function<? super T, ? extends R> mapper) {
        if (!present) return absent();
        return of(mapper.apply(value));
    }

    public void ifPresent(Consumer<? super T> action) {
        if (present) action.accept(value);
    }
}
