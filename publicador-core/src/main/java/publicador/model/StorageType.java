package publicador.model;

public enum StorageType {
  /** File kept by the media storage service; the storage path is its file id. */
  STORAGE,
  /** File already uploaded to Telegram; the storage path is the Telegram file id. */
  TELEGRAM
}
