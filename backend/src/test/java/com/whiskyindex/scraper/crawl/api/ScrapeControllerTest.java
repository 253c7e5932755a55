package com.whiskyindex.scraper.crawl.api;

import com.whiskyindex.scraper.crawl.model.BoundarySearchResult;
import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeProgressResponse;
import com.whiskyindex.scraper.crawl.model.ScrapeRunRequest;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.service.ActiveScrapeRunException;
import com.whiskyindex.scraper.crawl.service.ScrapeOrchestratorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeControllerTest {

    @Mock
    private ScrapeOrchestratorService orchestratorService;

    @Test
    void startReturnsAcceptedWithEffectiveRequest() {
        ScrapeRunRequest request = new ScrapeRunRequest(100L, 200L, false, 4, 50, null, false, false);
        when(orchestratorService.startAsync(request)).thenReturn(request);
        ScrapeController controller = new ScrapeController(orchestratorService);

        ResponseEntity<ScrapeRunRequest> response = controller.start(request);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertSame(request, response.getBody());
    }

    @Test
    void progressReportsCheckpointAndActivity() {
        ScrapeProgress progress = new ScrapeProgress(4200L, ScrapeStatus.RUNNING, null, null, null, null);
        when(orchestratorService.currentProgress()).thenReturn(progress);
        when(orchestratorService.isActive()).thenReturn(true);
        ScrapeController controller = new ScrapeController(orchestratorService);

        ScrapeProgressResponse response = controller.progress();

        assertEquals(4200L, response.progress().lastProcessedId());
        assertTrue(response.active());
    }

    @Test
    void stopRequestsShutdownBeforeReportingProgress() {
        when(orchestratorService.currentProgress()).thenReturn(ScrapeProgress.initial());
        ScrapeController controller = new ScrapeController(orchestratorService);

        controller.stop();

        InOrder order = inOrder(orchestratorService);
        order.verify(orchestratorService).requestStop();
        order.verify(orchestratorService).currentProgress();
    }

    @Test
    void findMaxIdDelegatesToBoundarySearch() {
        when(orchestratorService.findMaxId(1L)).thenReturn(new BoundarySearchResult(48210L, true, 61));
        ScrapeController controller = new ScrapeController(orchestratorService);

        BoundarySearchResult result = controller.findMaxId(1L);

        assertEquals(48210L, result.maxId());
    }

    @Test
    void activeRunMapsToConflict() {
        ScrapeExceptionHandler handler = new ScrapeExceptionHandler();

        ResponseEntity<Map<String, String>> response = handler.handleActiveRun(
            new ActiveScrapeRunException("Cannot start scrape run: another scrape run is in progress")
        );

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertThat(response.getBody()).containsEntry("error", "active_scrape_run");
    }

    @Test
    void invalidArgumentMapsToBadRequest() {
        ResponseEntity<Map<String, String>> response = new ScrapeExceptionHandler().handleBadRequest(
            new IllegalArgumentException("minNotFoundRate must be within [0, 1]")
        );

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertThat(response.getBody()).containsEntry("error", "invalid_request");
    }
}
