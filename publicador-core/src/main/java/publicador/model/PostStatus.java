package publicador.model;

public enum PostStatus {
  PENDING,
  PROCESSING,
  PUBLISHED,
  FAILED
}
