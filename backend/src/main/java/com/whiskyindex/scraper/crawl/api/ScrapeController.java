package com.whiskyindex.scraper.crawl.api;

import com.whiskyindex.scraper.crawl.model.BoundarySearchResult;
import com.whiskyindex.scraper.crawl.model.ScrapeProgressResponse;
import com.whiskyindex.scraper.crawl.model.ScrapeRunRequest;
import com.whiskyindex.scraper.crawl.service.ScrapeOrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final ScrapeOrchestratorService orchestratorService;

    public ScrapeController(ScrapeOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/start")
    public ResponseEntity<ScrapeRunRequest> start(@RequestBody(required = false) ScrapeRunRequest request) {
        ScrapeRunRequest accepted = orchestratorService.startAsync(request);
        return ResponseEntity.accepted().body(accepted);
    }

    @PostMapping("/stop")
    public ScrapeProgressResponse stop() {
        orchestratorService.requestStop();
        return progress();
    }

    @GetMapping("/progress")
    public ScrapeProgressResponse progress() {
        return new ScrapeProgressResponse(orchestratorService.currentProgress(), orchestratorService.isActive());
    }

    @PostMapping("/find-max-id")
    public BoundarySearchResult findMaxId(
        @RequestParam(name = "startId", required = false, defaultValue = "1") long startId
    ) {
        return orchestratorService.findMaxId(startId);
    }
}
