package com.example.scene.latexmath;

import com.example.latexmath.Application;
import com.example.latexmath.service.ConstrainedGenerationService;
import com.example.latexmath.service.LatexValidationService;
import com.example.latexmath.service.TransitionTableExporter;
import com.example.latexmath.service.ValidationArchiveService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = Application.class)
class LatexFsmApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextWiresJsonBackedServices() {
        assertNotNull(context.getBean(ObjectMapper.class));
        assertNotNull(context.getBean(ValidationArchiveService.class));
        assertNotNull(context.getBean(TransitionTableExporter.class));
        assertNotNull(context.getBean(LatexValidationService.class));
        assertNotNull(context.getBean(ConstrainedGenerationService.class));
    }
}
