package io.mdsistemas.invoicing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.mdsistemas.invoicing.helper.DocumentStyles;

@Configuration
public class DocumentConfig {

	@Value("${invoicing.document.banner-title:" + DocumentStyles.DEFAULT_BANNER_TITLE + "}")
	private String bannerTitle;

	@Bean
	public DocumentStyles documentStyles() {
		return DocumentStyles.withBannerTitle(bannerTitle);
	}
}
