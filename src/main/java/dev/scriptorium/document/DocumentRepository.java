package dev.scriptorium.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Document} entities. */
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /**
   * Returns one page of documents, newest first.
   *
   * @param limit maximum rows to return
   * @param offset rows to skip
   * @return documents ordered by creation time descending
   */
  @Query(
      value =
          """
            SELECT * FROM documents
            ORDER BY created_at DESC, id
            LIMIT :limit OFFSET :offset
            """,
      nativeQuery = true)
  List<Document> findPage(@Param("limit") int limit, @Param("offset") int offset);

  /**
   * Deletes a single document. Its chunks go with it through the {@code ON DELETE CASCADE}
   * foreign key.
   *
   * @param id the document id
   * @return number of document rows deleted (0 or 1)
   */
  @Modifying
  @Query(value = "DELETE FROM documents WHERE id = :id", nativeQuery = true)
  int deleteDocumentById(@Param("id") UUID id);

  /**
   * Deletes every document and, by cascade, every chunk.
   *
   * @return number of document rows deleted
   */
  @Modifying
  @Query(value = "DELETE FROM documents", nativeQuery = true)
  int deleteAllDocuments();
}
