package dev.memvid.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Pins the process-wide ONNX Runtime environment to a small thread budget before the embedding
 * model's static initializer creates it with defaults.
 *
 * <p>Runs as a {@link BeanFactoryPostProcessor} because the environment cannot be reconfigured once
 * created. Mock mode never loads a model and leaves the runtime untouched.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final String MOCK_PROPERTY = "memvid.mock";
  static final String ENVIRONMENT_NAME = "memvid-gateway";

  /** Index calls are serialized, so one query embedding runs at a time. */
  static final int INTRA_OP_THREADS = 2;

  static final int INTER_OP_THREADS = 1;

  private Environment environment;

  @Override
  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    if (isMockMode(environment)) {
      log.debug("Mock mode, ONNX Runtime left unconfigured");
      return;
    }
    pinThreads();
  }

  /** Same conversion as {@link MemvidProperties#isMock()}: true, on, yes and 1 enable it. */
  static boolean isMockMode(Environment environment) {
    return environment.getProperty(MOCK_PROPERTY, Boolean.class, false);
  }

  private static void pinThreads() {
    try (OrtEnvironment.ThreadingOptions options = new OrtEnvironment.ThreadingOptions()) {
      options.setGlobalSpinControl(false);
      options.setGlobalIntraOpNumThreads(INTRA_OP_THREADS);
      options.setGlobalInterOpNumThreads(INTER_OP_THREADS);
      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, ENVIRONMENT_NAME, options);
    } catch (OrtException e) {
      throw new IllegalStateException("Cannot set ONNX Runtime thread options", e);
    } catch (IllegalStateException e) {
      log.warn("ONNX Runtime was created before the gateway could size it: {}", e.getMessage());
      return;
    }
    log.info("ONNX Runtime threads: intra-op={}, inter-op={}", INTRA_OP_THREADS, INTER_OP_THREADS);
  }
}
