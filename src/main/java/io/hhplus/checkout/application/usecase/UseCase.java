package io.hhplus.checkout.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 애플리케이션 유스케이스 진입점 표시
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
