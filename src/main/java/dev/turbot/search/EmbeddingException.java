package dev.turbot.search;

/** Raised when the query text cannot be embedded; no search is possible without a query vector. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
