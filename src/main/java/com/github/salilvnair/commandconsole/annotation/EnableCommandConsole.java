package com.github.salilvnair.commandconsole.annotation;

import com.github.salilvnair.commandconsole.config.CommandConsoleAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(CommandConsoleAutoConfiguration.class)
public @interface EnableCommandConsole {
}
