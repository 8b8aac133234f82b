package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Scriptorium retrieval service.
 *
 * <p>Hosts the ingestion pipeline (extract, chunk, embed, persist) and the hybrid search path
 * (vector + fuzzy keyword retrieval, reciprocal rank fusion, optional cross-encoder reranking)
 * behind a thin REST adapter.
 */
@SpringBootApplication
public class ScriptoriumApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScriptoriumApplication.class, args);
    }
}
