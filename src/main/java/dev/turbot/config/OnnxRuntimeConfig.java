package dev.turbot.config;

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
 * Configures the ONNX Runtime environment used by the query embedding model before any model bean
 * is created.
 *
 * <p>Runs as a {@link BeanFactoryPostProcessor} because the environment is a process-wide singleton
 * that cannot be reconfigured once the embedding model's static initializer has called {@code
 * OrtEnvironment.getEnvironment()}.
 *
 * <p>Thread counts come from {@code turbot.onnx.intra-op-threads} (default 2) and {@code
 * turbot.onnx.inter-op-threads} (default 1). Query embedding runs one short text per request, so
 * small pools are enough; the search worker pool provides request-level parallelism.
 */
@Configuration
@SuppressWarnings("NullAway")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private Environment environment;

  @Override
  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    int intraOp = environment.getProperty("turbot.onnx.intra-op-threads", Integer.class, 2);
    int interOp = environment.getProperty("turbot.onnx.inter-op-threads", Integer.class, 1);

    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOp);
      threadingOptions.setGlobalInterOpNumThreads(interOp);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "turbot", threadingOptions);

      log.info("ONNX Runtime initialized: intra-op={}, inter-op={}", intraOp, interOp);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
