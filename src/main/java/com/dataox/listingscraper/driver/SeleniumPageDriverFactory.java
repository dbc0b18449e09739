package com.dataox.listingscraper.driver;

import io.github.bonigarcia.wdm.WebDriverManager;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;

/**
 * Starts one Chrome session per scrape, either on a Selenium grid or locally.
 */
@Slf4j
public class SeleniumPageDriverFactory implements PageDriverFactory {

    private final ChromeOptions chromeOptions;
    private final String remoteUrl;
    private final Duration pageLoadTimeout;
    private final Duration scriptTimeout;

    private volatile boolean localBinaryReady;

    public SeleniumPageDriverFactory(ChromeOptions chromeOptions,
                                     String remoteUrl,
                                     Duration pageLoadTimeout,
                                     Duration scriptTimeout) {
        this.chromeOptions = chromeOptions;
        this.remoteUrl = remoteUrl == null ? "" : remoteUrl.trim();
        this.pageLoadTimeout = pageLoadTimeout;
        this.scriptTimeout = scriptTimeout;
    }

    @Override
    public PageDriver open() {
        WebDriver driver = newDriver();
        try {
            driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
            driver.manage().timeouts().scriptTimeout(scriptTimeout);
        } catch (RuntimeException e) {
            driver.quit();
            throw new PageDriverException("Failed to configure browser session: " + e.getMessage(), e);
        }
        return new SeleniumPageDriver(driver);
    }

    private WebDriver newDriver() {
        try {
            if (!remoteUrl.isBlank()) {
                log.info("Using remote Selenium grid: {}", remoteUrl);
                try {
                    return new RemoteWebDriver(new URL(remoteUrl), chromeOptions);
                } catch (RuntimeException e) {
                    String alt = remoteUrl.endsWith("/") ? remoteUrl + "wd/hub" : remoteUrl + "/wd/hub";
                    log.warn("Remote grid {} refused the session ({}), retrying with {}", remoteUrl, e.getMessage(), alt);
                    return new RemoteWebDriver(new URL(alt), chromeOptions);
                }
            }
            ensureLocalBinary();
            log.debug("Using local ChromeDriver");
            return new ChromeDriver(chromeOptions);
        } catch (MalformedURLException | RuntimeException e) {
            throw new PageDriverException("Failed to start browser via " +
                    (remoteUrl.isBlank() ? "local ChromeDriver" : remoteUrl) + ": " + e.getMessage(), e);
        }
    }

    // resolved on first use so the service can start without a browser installed
    private void ensureLocalBinary() {
        if (localBinaryReady) {
            return;
        }
        synchronized (this) {
            if (!localBinaryReady) {
                WebDriverManager.chromedriver().setup();
                localBinaryReady = true;
            }
        }
    }
}
