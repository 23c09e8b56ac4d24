package dev.memvid.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.mock.env.MockEnvironment;

class OnnxRuntimeConfigTest {

  @ParameterizedTest
  @CsvSource({"true, true", "TRUE, true", "1, true", "yes, true", "false, false", "0, false"})
  void mock_flag_is_read_like_the_bound_property(String value, boolean expected) {
    MockEnvironment environment = new MockEnvironment().withProperty("memvid.mock", value);

    assertThat(OnnxRuntimeConfig.isMockMode(environment)).isEqualTo(expected);
  }

  @Test
  void missing_mock_flag_means_real_backend() {
    assertThat(OnnxRuntimeConfig.isMockMode(new MockEnvironment())).isFalse();
  }

  @Test
  void mock_mode_leaves_runtime_alone() {
    OnnxRuntimeConfig config = new OnnxRuntimeConfig();
    config.setEnvironment(new MockEnvironment().withProperty("memvid.mock", "1"));
    ConfigurableListableBeanFactory beanFactory = mock(ConfigurableListableBeanFactory.class);

    assertThatCode(() -> config.postProcessBeanFactory(beanFactory)).doesNotThrowAnyException();
    verifyNoInteractions(beanFactory);
  }
}
