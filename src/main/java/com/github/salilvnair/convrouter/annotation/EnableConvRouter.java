package com.github.salilvnair.convrouter.annotation;

import com.github.salilvnair.convrouter.config.ConvRouterAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ConvRouterAutoConfiguration.class)
public @interface EnableConvRouter {
}
