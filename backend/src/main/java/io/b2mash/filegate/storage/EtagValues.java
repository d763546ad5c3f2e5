package io.b2mash.filegate.storage;

/** ETag normalisation. Stores quote the value on the wire; records keep it bare. */
public final class EtagValues {

  private EtagValues() {}

  public static String strip(String etag) {
    if (etag == null) {
      return null;
    }
    String stripped = etag.replace("\"", "").trim();
    return stripped.isEmpty() ? null : stripped;
  }
}
