package com.flamingo.ai.papersplit;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.papersplit.config.SplitterConfig;
import com.flamingo.ai.papersplit.service.analysis.DocumentAnalyzer;
import com.flamingo.ai.papersplit.service.processing.PaperProcessingService;
import com.flamingo.ai.papersplit.service.split.DocumentSplitter;
import com.flamingo.ai.papersplit.service.storage.DocumentStorage;
import com.flamingo.ai.papersplit.service.storage.LocalDocumentStorage;
import io.micrometer.core.aop.TimedAspect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies that the application context wires the processing pipeline from configuration. */
@SpringBootTest(
    properties = {
      "splitter.storage.base-path=target/test-storage",
      "splitter.header.region-ratio=0.25"
    })
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(PaperProcessingService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentAnalyzer.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentSplitter.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentStorage.class))
        .isInstanceOf(LocalDocumentStorage.class);
    assertThat(applicationContext.getBean(TimedAspect.class)).isNotNull();
  }

  @Test
  @DisplayName("Splitter properties should bind over the defaults")
  void splitterPropertiesShouldBind() {
    SplitterConfig config = applicationContext.getBean(SplitterConfig.class);

    assertThat(config.getStorage().getBasePath()).isEqualTo("target/test-storage");
    assertThat(config.getHeader().getRegionRatio()).isEqualTo(0.25f);
    assertThat(config.getHeader().getLineTolerance()).isEqualTo(2.0f);
    assertThat(config.getStorage().getAnalysisFileName()).isEqualTo("analysis.json");
  }
}
