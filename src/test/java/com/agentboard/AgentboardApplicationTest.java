package com.agentboard;

import com.agentboard.config.BoardProperties;
import com.agentboard.core.health.WorkspaceHealthIndicator;
import com.agentboard.core.model.Task;
import com.agentboard.core.store.TaskStore;
import com.agentboard.core.subscription.MentionMatching;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "spring.jmx.enabled=true")
class AgentboardApplicationTest {

    @TempDir
    static Path workspaceDir;

    @DynamicPropertySource
    static void boardProperties(DynamicPropertyRegistry registry) {
        registry.add("agentboard.workspace", () -> workspaceDir.resolve("workspace").toString());
        registry.add("agentboard.mentions.matching", () -> "TOKEN");
        registry.add("agentboard.notification.preview-length", () -> "20");
    }

    @Autowired
    TaskStore taskStore;

    @Autowired
    BoardProperties properties;

    @Autowired
    WorkspaceHealthIndicator healthIndicator;

    @Autowired
    HealthEndpoint healthEndpoint;

    @Autowired
    MBeanServer mBeanServer;

    @Test
    @DisplayName("binds agentboard properties and wires a working store")
    void contextLoads() {
        assertEquals(MentionMatching.TOKEN, properties.getMentions().getMatching());
        assertEquals(20, properties.getNotification().getPreviewLength());
        assertEquals(3, properties.getIo().getMaxAttempts());

        Task task = taskStore.createTask("Wire up", "context test");

        assertTrue(Files.exists(workspaceDir.resolve("workspace/tasks/inbox/" + task.id() + ".md")));
        assertEquals(task, taskStore.getTask(task.id()));
        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }

    @Test
    @DisplayName("workspace health is published through the health endpoint over JMX")
    void healthOverJmx() throws MalformedObjectNameException {
        taskStore.createTask("Health", "");

        assertEquals(Status.UP, healthEndpoint.healthForPath("workspace").getStatus());
        assertFalse(mBeanServer.queryNames(
                new ObjectName("org.springframework.boot:type=Endpoint,name=Health,*"), null).isEmpty());
    }
}
