package com.example.stitchschemata.command;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Lets picocli obtain commands from the application context so they get their
 * services injected; anything that is not a bean is created reflectively.
 */
@Component
@RequiredArgsConstructor
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext applicationContext;

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        try {
            return applicationContext.getBean(cls);
        } catch (NoSuchBeanDefinitionException e) {
            return CommandLine.defaultFactory().create(cls);
        }
    }
}
