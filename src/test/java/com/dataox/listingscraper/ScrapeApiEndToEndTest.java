package com.dataox.listingscraper;

import com.dataox.listingscraper.driver.Anchor;
import com.dataox.listingscraper.driver.FakePageDriver;
import com.dataox.listingscraper.driver.FakePageDriver.FixturePage;
import com.dataox.listingscraper.driver.PageDriverException;
import com.dataox.listingscraper.driver.PageDriverFactory;
import com.dataox.listingscraper.model.JobStatus;
import com.dataox.listingscraper.model.ScrapeJob;
import com.dataox.listingscraper.repository.JobStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.oneOf;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "scraper.pagination.probe-timeout=0ms",
        "scraper.pagination.settle-delay=0ms",
        "scraper.pagination.next-page-delay=0ms"
})
class ScrapeApiEndToEndTest {

    private static final long POLL_DEADLINE_MS = 10_000;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PageDriverFactory driverFactory;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    private static Anchor listing(String slug, String price) {
        return new Anchor("Apartment " + slug + "\n" + price + " EGP\n" + "140 م²", null,
                "https://example.test/listing/" + slug);
    }

    private String submit(String body) throws Exception {
        MvcResult res = mockMvc.perform(post("/scrape").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andReturn();
        return objectMapper.readTree(res.getResponse().getContentAsString()).get("jobId").asText();
    }

    private JsonNode pollUntilFinished(String jobId, List<Integer> progressSeen) throws Exception {
        long deadline = System.currentTimeMillis() + POLL_DEADLINE_MS;
        while (true) {
            String json = mockMvc.perform(get("/job/" + jobId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            JsonNode node = objectMapper.readTree(json);
            progressSeen.add(node.get("progress").asInt());
            String status = node.get("status").asText();
            if (status.equals("completed") || status.equals("failed")) {
                return node;
            }
            assertThat(System.currentTimeMillis()).as("job %s still %s", jobId, status).isLessThan(deadline);
            Thread.sleep(20);
        }
    }

    @Test
    void threePageScrapeCompletesWithUniqueListings() throws Exception {
        FakePageDriver driver = new FakePageDriver(List.of(
                FixturePage.withNext(listing("1", "300,000"), listing("2", "450,000"),
                        new Anchor("عقارات في الجيزة 1,200", null, "https://example.test/category")),
                FixturePage.withNext(listing("2", "460,000"), listing("3", "500,000")),
                FixturePage.last(listing("4", "1,100,000"), new Anchor("Apartment 5000", null, "https://x/5"))));
        when(driverFactory.open()).thenReturn(driver);

        String jobId = submit("{\"originUrl\":\"https://example.test/listings\",\"limit_pages\":3}");
        assertThat(jobStore.find(jobId)).isPresent();

        List<Integer> progress = new ArrayList<>();
        JsonNode done = pollUntilFinished(jobId, progress);

        assertThat(done.get("status").asText()).isEqualTo("completed");
        assertThat(done.get("progress").asInt()).isEqualTo(100);
        assertThat(done.get("count").asInt()).isEqualTo(4);
        assertThat(done.get("data").findValuesAsText("link")).containsExactly(
                "https://example.test/listing/1", "https://example.test/listing/2",
                "https://example.test/listing/3", "https://example.test/listing/4");
        assertThat(done.get("data").get(1).get("price").asText()).isEqualTo("460,000");
        assertThat(done.get("data").get(0).get("area").asText()).isEqualTo("140");
        assertThat(done.get("completedAt").isNull()).isFalse();
        assertThat(progress).isSorted().allMatch(p -> p >= 0 && p <= 100);

        ScrapeJob stored = jobStore.find(jobId).orElseThrow();
        assertThat(stored.currentPage()).isEqualTo(3);
        assertThat(stored.totalPages()).isEqualTo(3);
        assertThat(driver.isClosed()).isTrue();
    }

    @Test
    void jobIsQueuedOrRunningRightAfterSubmission() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(driverFactory.open()).thenAnswer(inv -> {
            if (!release.await(POLL_DEADLINE_MS, TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("browser session was never released");
            }
            return new FakePageDriver(List.of(FixturePage.last(listing("q", "100,000"))));
        });

        String jobId = submit("{\"originUrl\":\"https://example.test/listings\"}");
        try {
            assertThat(jobStore.find(jobId).orElseThrow().status()).isIn(JobStatus.QUEUED, JobStatus.RUNNING);
            mockMvc.perform(get("/job/" + jobId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value(oneOf("queued", "running")))
                    .andExpect(jsonPath("$.data").doesNotExist());
        } finally {
            release.countDown();
        }

        assertThat(pollUntilFinished(jobId, new ArrayList<>()).get("status").asText()).isEqualTo("completed");
    }

    @Test
    void earlyStopKeepsRequestedTotalPages() throws Exception {
        when(driverFactory.open()).thenReturn(new FakePageDriver(List.of(
                FixturePage.withNext(listing("a", "100,000")),
                FixturePage.last(listing("b", "200,000")))));

        String jobId = submit("{\"originUrl\":\"https://example.test/listings\",\"limit_pages\":5}");
        JsonNode done = pollUntilFinished(jobId, new ArrayList<>());

        assertThat(done.get("status").asText()).isEqualTo("completed");
        ScrapeJob stored = jobStore.find(jobId).orElseThrow();
        assertThat(stored.currentPage()).isEqualTo(2);
        assertThat(stored.totalPages()).isEqualTo(5);
    }

    @Test
    void browserStartupFailureIsVisibleOnPoll() throws Exception {
        when(driverFactory.open()).thenThrow(new PageDriverException("Failed to start browser via local ChromeDriver"));

        String jobId = submit("{\"originUrl\":\"https://example.test/listings\"}");
        JsonNode done = pollUntilFinished(jobId, new ArrayList<>());

        assertThat(done.get("status").asText()).isEqualTo("failed");
        assertThat(done.get("progress").asInt()).isZero();
        assertThat(done.get("error").asText()).isEqualTo("Failed to start browser via local ChromeDriver");
        assertThat(done.get("data")).isEmpty();
        assertThat(jobStore.find(jobId).orElseThrow().status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void submittedJobsAppearInJobList() throws Exception {
        // each job gets its own session
        when(driverFactory.open()).thenAnswer(inv -> new FakePageDriver(List.of(FixturePage.last(listing("z", "100,000")))));

        String first = submit("{\"originUrl\":\"https://example.test/one\"}");
        String second = submit("{\"originUrl\":\"https://example.test/two\"}");
        assertThat(first).isNotEqualTo(second);

        String json = mockMvc.perform(get("/jobs"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertThat(objectMapper.readTree(json).get("jobs").findValuesAsText("jobId")).contains(first, second);
    }

    @Test
    void missingOriginUrlCreatesNoJob() throws Exception {
        int before = jobStore.findAll().size();

        mockMvc.perform(post("/scrape").contentType(MediaType.APPLICATION_JSON).content("{\"limit_pages\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing originUrl"));

        assertThat(jobStore.findAll()).hasSize(before);
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/job/job_0_unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found"));
    }

    @Test
    void healthIsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }
}
