package com.dataox.listingscraper.config;

import com.dataox.listingscraper.driver.PageDriverFactory;
import com.dataox.listingscraper.driver.SeleniumPageDriverFactory;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebDriverConfig {

    @Value("${SELENIUM_REMOTE_URL:}")
    private String remoteUrl;

    @Bean
    public PageDriverFactory pageDriverFactory(ChromeOptions chromeOptions, ScraperProperties properties) {
        ScraperProperties.Browser browser = properties.getBrowser();
        return new SeleniumPageDriverFactory(
                chromeOptions,
                remoteUrl,
                browser.getPageLoadTimeout(),
                browser.getScriptTimeout()
        );
    }
}
