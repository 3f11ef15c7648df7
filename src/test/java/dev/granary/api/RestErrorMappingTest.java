package dev.granary.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.granary.analysis.AnalysisOrchestrator;
import dev.granary.analysis.ReanalysisRejectedException;
import dev.granary.catalog.CatalogService;
import dev.granary.crawl.CrawlDispatcher;
import dev.granary.crawl.CrawlJobRunner;
import dev.granary.dedup.GroupReviewService;
import dev.granary.search.HybridSearchService;
import dev.granary.storage.AttachmentLinks;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** HTTP status codes of the REST surface, including the problem-detail error mapping. */
@WebMvcTest(
    controllers = {
      CrawlController.class,
      AttachmentController.class,
      SearchController.class,
      AnnouncementController.class,
      GroupController.class
    })
@SuppressWarnings("NullAway.Init")
class RestErrorMappingTest {

  @Autowired MockMvc mockMvc;

  @MockBean CrawlDispatcher crawlDispatcher;
  @MockBean CrawlJobRunner crawlJobRunner;
  @MockBean CatalogService catalogService;
  @MockBean AttachmentLinks attachmentLinks;
  @MockBean AnalysisOrchestrator analysisOrchestrator;
  @MockBean HybridSearchService hybridSearchService;
  @MockBean GroupReviewService groupReviewService;

  @Test
  void dispatchIsAccepted() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(crawlDispatcher.dispatchActiveSources()).thenReturn(List.of(jobId));

    mockMvc
        .perform(post("/api/crawl/dispatch"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobIds[0]").value(jobId.toString()));
  }

  @Test
  void dispatchDuringBatchIsConflict() throws Exception {
    when(crawlDispatcher.dispatchActiveSources())
        .thenThrow(new IllegalStateException("A crawl batch is already running"));

    mockMvc
        .perform(post("/api/crawl/dispatch"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.detail").value("A crawl batch is already running"));
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(crawlJobRunner.getJob(jobId))
        .thenThrow(new NoSuchElementException("Crawl job not found: " + jobId));

    mockMvc
        .perform(get("/api/crawl/jobs/{id}", jobId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404));
  }

  @Test
  void rejectedReanalysisIsConflict() throws Exception {
    UUID attachmentId = UUID.randomUUID();
    when(analysisOrchestrator.requestReanalysis(attachmentId, false))
        .thenThrow(new ReanalysisRejectedException(attachmentId, "analysis already running"));

    mockMvc
        .perform(post("/api/attachments/{id}/reanalyze", attachmentId))
        .andExpect(status().isConflict());
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"queryText\": \" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("queryText")));
    verifyNoInteractions(hybridSearchService);
  }

  @Test
  void oversizedMatchCountIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"queryText\": \"수출\", \"matchCount\": 500000000}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("matchCount")));
    verifyNoInteractions(hybridSearchService);
  }

  @Test
  void unknownSourceTypeIsBadRequest() throws Exception {
    when(hybridSearchService.requestFor(eq("수출"), eq("brochure"), any(), any(), any()))
        .thenThrow(new IllegalArgumentException("Unknown source type: brochure"));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"queryText\": \"수출\", \"sourceType\": \"brochure\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Unknown source type: brochure"));
  }

  @Test
  void deletingAnAnnouncementIsNoContent() throws Exception {
    UUID announcementId = UUID.randomUUID();
    when(catalogService.deleteAnnouncement(announcementId)).thenReturn(true);

    mockMvc
        .perform(delete("/api/announcements/{id}", announcementId))
        .andExpect(status().isNoContent());
    verify(catalogService).deleteAnnouncement(announcementId);
  }

  @Test
  void deletingAnUnknownAnnouncementIsNotFound() throws Exception {
    UUID announcementId = UUID.randomUUID();
    when(catalogService.deleteAnnouncement(announcementId))
        .thenThrow(new NoSuchElementException("Announcement not found: " + announcementId));

    mockMvc
        .perform(delete("/api/announcements/{id}", announcementId))
        .andExpect(status().isNotFound());
  }

  @Test
  void foreignCanonicalIsBadRequest() throws Exception {
    UUID groupId = UUID.randomUUID();
    UUID outsider = UUID.randomUUID();
    when(groupReviewService.review(groupId, null, outsider))
        .thenThrow(new IllegalArgumentException("Announcement " + outsider + " is not a member"));

    mockMvc
        .perform(
            patch("/api/groups/{id}", groupId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"canonicalAnnouncementId\": \"" + outsider + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("not a member")));
  }

  @Test
  void dissolvingAGroupIsNoContent() throws Exception {
    UUID groupId = UUID.randomUUID();
    when(groupReviewService.dissolve(groupId)).thenReturn(2);

    mockMvc.perform(delete("/api/groups/{id}", groupId)).andExpect(status().isNoContent());
  }

  @Test
  void unknownGroupIsNotFound() throws Exception {
    UUID groupId = UUID.randomUUID();
    when(groupReviewService.getGroup(groupId))
        .thenThrow(new NoSuchElementException("Project group not found: " + groupId));

    mockMvc.perform(get("/api/groups/{id}", groupId)).andExpect(status().isNotFound());
  }
}
