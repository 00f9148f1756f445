package dev.fumaz.augment.coerce;

/**
 * Performs some action against a subject. The usual capability type for configuration-style methods.
 *
 * @param <T> the type of the subject
 */
@FunctionalInterface
public interface Action<T> {

    void execute(T subject);

}
