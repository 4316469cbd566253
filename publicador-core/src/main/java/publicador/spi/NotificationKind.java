package publicador.spi;

public enum NotificationKind {
  PUBLICATION_FAILED,
  PUBLICATION_PARTIAL
}
