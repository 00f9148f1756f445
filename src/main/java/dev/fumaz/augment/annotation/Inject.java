package dev.fumaz.augment.annotation;

import java.lang.annotation.*;

/**
 * Marks a getter as an injection point. Its value is looked up from the service lookup on first access
 * and cached for the lifetime of the decorated instance.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {

    /**
     * Service key to look up. When left as {@code void.class} the getter's declared return type is used.
     */
    Class<?> service() default void.class;

}
