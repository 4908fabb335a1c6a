package io.tacoq.worker.sdk.autoconfigure;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link io.tacoq.worker.sdk.api.TaskHandler} bean as the handler for a task kind.
 * <p>
 * The auto-configuration registers every annotated bean with the {@link io.tacoq.worker.sdk.runtime.WorkerEngine}
 * before it starts. Works on handler classes and on {@code @Bean} factory methods.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TacoqTask {

    /**
     * Task kind handled by the bean.
     */
    String value();
}
