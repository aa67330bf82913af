package com.github.feedflow.controller;

import com.github.feedflow.model.CandidateFormat;
import com.github.feedflow.model.ExtractionResult;
import com.github.feedflow.service.extraction.ExtractionRunner;
import com.github.feedflow.service.token.CapabilityTokenCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * No signing secret and no access token: both endpoints accept anonymous requests.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("open proxy mode")
class OpenProxyModeIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CapabilityTokenCodec tokenCodec;

    @MockBean
    private ExtractionRunner extractionRunner;

    private MockWebServer upstream;

    @BeforeEach
    void setUp() throws IOException {
        upstream = new MockWebServer();
        upstream.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        upstream.shutdown();
    }

    private void stubExtraction(String videoId) {
        when(extractionRunner.resolve(videoId)).thenReturn(ExtractionResult.builder()
                .videoId(videoId)
                .title("Open mode")
                .durationSeconds(30)
                .format(CandidateFormat.builder()
                        .formatId("18").ext("mp4").vcodec("avc1").acodec("mp4a").height(360)
                        .url(upstream.url("/videoplayback").toString())
                        .build())
                .build());
    }

    @Test
    @DisplayName("codec should be disabled")
    void codecShouldBeDisabled() {
        assertThat(tokenCodec.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("/stream should issue unsigned proxy URLs without authentication")
    void streamShouldIssueUnsignedUrls() throws Exception {
        stubExtraction("openStream1");

        String body = mockMvc.perform(get("/api/youtube/stream/openStream1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoUrl").value("http://localhost/api/youtube/proxy/openStream1?type=video"))
                .andExpect(jsonPath("$.audioUrl").value("http://localhost/api/youtube/proxy/openStream1?type=audio"))
                .andReturn().getResponse().getContentAsString();

        assertThat(body).doesNotContain("sig=").doesNotContain("exp=");
    }

    @Test
    @DisplayName("/proxy should relay without a token")
    void proxyShouldRelayWithoutToken() throws Exception {
        stubExtraction("openProxy01");
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "video/mp4").setBody("media-bytes"));

        MvcResult started = mockMvc.perform(get("/api/youtube/proxy/openProxy01"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().string("media-bytes"));
    }

    @Test
    @DisplayName("/proxy should ignore stray token parameters")
    void proxyShouldIgnoreStrayTokens() throws Exception {
        stubExtraction("openProxy02");
        upstream.enqueue(new MockResponse().setBody("ok"));

        MvcResult started = mockMvc.perform(get("/api/youtube/proxy/openProxy02")
                        .param("exp", "1")
                        .param("sig", "garbage"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk());
    }
}
