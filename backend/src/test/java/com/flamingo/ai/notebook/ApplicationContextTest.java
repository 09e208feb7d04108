package com.flamingo.ai.notebook;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.notebook.service.chat.ChatOrchestrator;
import com.flamingo.ai.notebook.service.context.NotebookContextSelector;
import com.flamingo.ai.notebook.service.notebook.NotebookService;
import com.flamingo.ai.notebook.service.source.SourceRegistry;
import com.flamingo.ai.notebook.service.transformation.TransformationExecutor;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads against a throwaway SQLite file. The chat model is mocked
 * so no API key is needed.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:sqlite:target/context-test.db")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline and chat beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(NotebookService.class)).isNotNull();
    assertThat(applicationContext.getBean(SourceRegistry.class)).isNotNull();
    assertThat(applicationContext.getBean(TransformationExecutor.class)).isNotNull();
    assertThat(applicationContext.getBean(NotebookContextSelector.class)).isNotNull();
    assertThat(applicationContext.getBean(ChatOrchestrator.class)).isNotNull();
  }
}
