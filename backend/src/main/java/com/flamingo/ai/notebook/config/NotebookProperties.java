package com.flamingo.ai.notebook.config;

import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the source pipeline and chat orchestration. */
@Configuration
@ConfigurationProperties(prefix = "notebook")
@Getter
@Setter
public class NotebookProperties {

  private Extraction extraction = new Extraction();
  private Generation generation = new Generation();
  private Context context = new Context();
  private Chat chat = new Chat();
  private Ingestion ingestion = new Ingestion();

  /** Transformations added to, or overriding, the built-in catalog. */
  private List<TransformationDefinition> transformations = new ArrayList<>();

  @Getter
  @Setter
  public static class Extraction {
    private Duration timeout = Duration.ofSeconds(60);
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;

    /** Largest response body accepted when fetching URL sources. */
    private int maxUrlBytes = 20 * 1024 * 1024;

    private String userAgent = "research-notebook/0.1";
  }

  @Getter
  @Setter
  public static class Generation {
    private Duration timeout = Duration.ofSeconds(120);
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;

    /** Extracted content beyond this many characters is cut before prompting. */
    private int maxInputChars = 50_000;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxItems = 5;
    private int maxChars = 8_000;
    private int excerptChars = 1_200;
  }

  @Getter
  @Setter
  public static class Chat {
    /** Number of earlier messages sent to the assistant with each post. */
    private int historyWindow = 10;

    private String defaultTitlePattern = "'Chat on' yyyy-MM-dd HH:mm";

    private String systemPrompt =
        "You are a research assistant helping the user understand the material collected in "
            + "their notebook. Ground your answers in the notebook context when it is relevant "
            + "and say so when the context does not cover the question.";
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Transformations applied to every source once its content is extracted. */
    private List<String> defaultTransformations = new ArrayList<>();
  }

  /** A transformation declared in configuration. */
  @Getter
  @Setter
  public static class TransformationDefinition {
    private String name;
    private String description;
    private String prompt;
    private ArtifactKind kind = ArtifactKind.TEXT;
    private Map<String, String> defaultParams = new LinkedHashMap<>();
  }
}
