package com.dataox.listingscraper.driver;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PageDriver} backed by a Selenium {@link WebDriver}. One instance per browser session.
 */
@Slf4j
public class SeleniumPageDriver implements PageDriver {

    private static final String READ_ANCHORS_SCRIPT = """
            return Array.from(document.querySelectorAll('a')).map(a => {
              const heading = a.querySelector('h3, h4');
              return {
                text: a.innerText || '',
                heading: heading ? (heading.innerText || '') : null,
                href: a.href || ''
              };
            });
            """;

    private final WebDriver driver;

    public SeleniumPageDriver(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url) {
        driver.get(url);
    }

    @Override
    public boolean waitFor(String cssSelector, Duration timeout) {
        try {
            new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Anchor> readAnchors() {
        Object res = ((JavascriptExecutor) driver).executeScript(READ_ANCHORS_SCRIPT);
        if (!(res instanceof List<?> rows)) {
            return List.of();
        }
        List<Anchor> anchors = new ArrayList<>(rows.size());
        for (Object row : rows) {
            Map<String, Object> r = (Map<String, Object>) row;
            anchors.add(new Anchor(str(r.get("text")), (String) r.get("heading"), str(r.get("href"))));
        }
        return anchors;
    }

    @Override
    public Optional<PageControl> findControl(String label) {
        String literal = xpathLiteral(label);
        By byLabel = By.xpath(
                "//button[contains(normalize-space(.)," + literal + ") or contains(@aria-label," + literal + ")]" +
                        " | //*[@role='button'][contains(normalize-space(.)," + literal + ")"
                        + " or contains(@aria-label," + literal + ")]"
        );
        List<WebElement> found = driver.findElements(byLabel);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        WebElement first = found.get(0);
        if (!first.isDisplayed()) {
            log.debug("Control '{}' is present but hidden", label);
            return Optional.empty();
        }
        return Optional.of(new SeleniumControl(label, first));
    }

    @Override
    public void activate(PageControl control) {
        if (!(control instanceof SeleniumControl sc)) {
            throw new IllegalArgumentException("Control was not produced by this driver: " + control.label());
        }
        JavascriptExecutor js = (JavascriptExecutor) driver;
        js.executeScript("arguments[0].scrollIntoView({block:'center'});", sc.element());
        sc.element().click();
    }

    @Override
    public void close() {
        driver.quit();
    }

    private static String str(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    // XPath 1.0 has no escape sequences, quotes have to be split with concat()
    static String xpathLiteral(String s) {
        if (!s.contains("'")) {
            return "'" + s + "'";
        }
        if (!s.contains("\"")) {
            return "\"" + s + "\"";
        }
        return "concat('" + s.replace("'", "',\"'\",'") + "')";
    }

    private record SeleniumControl(String label, WebElement element) implements PageControl {
    }
}
