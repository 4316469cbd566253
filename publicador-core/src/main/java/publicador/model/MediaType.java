package publicador.model;

import java.util.Locale;

public enum MediaType {
  IMAGE,
  VIDEO,
  AUDIO,
  DOCUMENT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
