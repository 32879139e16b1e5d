package com.jsonvaluate.spring;

import com.jsonvaluate.adapter.spring.ConditionEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the condition engine in a Spring application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableConditionEngine
 * public class MyApplication {
 *     &#64;Bean
 *     CustomOperator iequal() {
 *         return CustomOperator.of("iequal", (field, expected) -&gt;
 *                 ValueCoercion.toString(field).equalsIgnoreCase(ValueCoercion.toString(expected)));
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ConditionEngineAutoConfiguration.class)
public @interface EnableConditionEngine {
}
