package com.scholary.captions.config;

import com.scholary.captions.media.MediaProperties;
import com.scholary.captions.understanding.UnderstandingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the caption, audio understanding and media properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  CaptionProperties.class,
  UnderstandingProperties.class,
  MediaProperties.class
})
public class CaptionConfig {}
