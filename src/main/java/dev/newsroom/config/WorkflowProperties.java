package dev.newsroom.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "newsroom.workflow")
public class WorkflowProperties {

    /** {@code least-loaded} or {@code round-robin}. */
    private String assignmentStrategy = "least-loaded";

    /** When false only EDITOR and above may publish. */
    private boolean subEditorCanPublish = true;
}
