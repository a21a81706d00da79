package com.resourcex.aspect;

import com.resourcex.service.ResourceService;
import com.resourcex.exception.CollectionNotFoundException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
public class TimingAspectTest {

    @Autowired
    private ResourceService resourceService;

    @Test
    public void testExecutionTimeIsClearedAfterRead() {
        String executionTime = TimingAspect.getAndClearExecutionTime();
        assertNotNull(executionTime);
        assertTrue(executionTime.endsWith("ms"));

        assertEquals("0ms", TimingAspect.getAndClearExecutionTime());
    }

    @Test
    public void testFailedTimedCallIsStillMeasured() {
        TimingAspect.getAndClearExecutionTime();

        assertThrows(CollectionNotFoundException.class, () -> resourceService.series("missing", "ghi", 0));

        String executionTime = TimingAspect.getAndClearExecutionTime();
        assertTrue(executionTime.matches("\\d+ms"), executionTime);
    }
}
