package dev.scriptorium.api;

import dev.scriptorium.search.SearchService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Search endpoint.
 *
 * <pre>
 *   POST /api/search  {"query": "what are cats", "limit": 5}
 * </pre>
 *
 * <p>Validation errors map to 400, unreachable embedding or store to 503 (see {@code
 * GlobalExceptionHandler}).
 */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final SearchService searchService;

  public SearchController(SearchService searchService) {
    this.searchService = searchService;
  }

  @PostMapping("/search")
  public SearchApiResponse search(@RequestBody SearchApiRequest request) {
    return SearchApiResponse.from(searchService.search(request.toSearchRequest()));
  }
}
