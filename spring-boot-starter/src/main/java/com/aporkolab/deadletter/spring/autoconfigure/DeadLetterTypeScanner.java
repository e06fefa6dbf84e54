package com.aporkolab.deadletter.spring.autoconfigure;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.AnnotatedBeanDefinition;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.type.filter.AnnotationTypeFilter;

import com.aporkolab.deadletter.routing.DeadLetter;

/**
 * Finds {@link DeadLetter}-annotated message types under the configured base packages.
 * Only class names are collected; loading and validation happen when the registry is built.
 */
class DeadLetterTypeScanner {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterTypeScanner.class);

    private final ClassPathScanningCandidateComponentProvider provider;

    DeadLetterTypeScanner(ClassLoader classLoader) {
        this.provider = new ClassPathScanningCandidateComponentProvider(false) {
            @Override
            protected boolean isCandidateComponent(AnnotatedBeanDefinition beanDefinition) {
                return beanDefinition.getMetadata().isIndependent();
            }
        };
        this.provider.addIncludeFilter(new AnnotationTypeFilter(DeadLetter.class));
        if (classLoader != null) {
            this.provider.setResourceLoader(new DefaultResourceLoader(classLoader));
        }
    }

    Set<String> scan(Collection<String> basePackages) {
        Set<String> classNames = new TreeSet<>();
        for (String basePackage : basePackages) {
            for (BeanDefinition candidate : provider.findCandidateComponents(basePackage)) {
                classNames.add(candidate.getBeanClassName());
            }
        }
        log.debug("Found {} dead letter message type(s) in {}", classNames.size(), basePackages);
        return classNames;
    }
}
