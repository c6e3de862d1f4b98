package com.github.salilvnair.commandconsole.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.commandconsole")
@ComponentScan(basePackages = "com.github.salilvnair.commandconsole")
@EntityScan(basePackages = "com.github.salilvnair.commandconsole.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.commandconsole.repo")
public class CommandConsoleAutoConfiguration {
}
