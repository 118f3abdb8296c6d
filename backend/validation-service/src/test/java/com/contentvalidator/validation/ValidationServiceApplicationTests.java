package com.contentvalidator.validation;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

/**
 * Verifies the application context starts with the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
    // No collaborator services in tests
    "scan.clients.llm-base-url=",
    "scan.clients.axe-base-url="
})
class ValidationServiceApplicationTests {

    @Test
    void contextLoads() {
        // passes when the context starts
    }
}
