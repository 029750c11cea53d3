package dev.librarian.files;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * SHA-256 hashing of file contents with an in-memory cache keyed by path and modification time.
 *
 * <p>Entries are only ever added. A file modified after hashing has a new modification time and
 * therefore a new key, so stale entries are never returned.
 */
@Component
public class FileHasher {

  private static final int BUFFER_SIZE = 64 * 1024;

  private final ConcurrentHashMap<CacheKey, String> cache = new ConcurrentHashMap<>();

  /**
   * Hash of the file's content, served from the cache when the file is unchanged.
   *
   * @param file regular file to hash
   * @return lowercase hex SHA-256
   * @throws IOException if the file is missing or unreadable
   */
  public String hash(Path file) throws IOException {
    Path absolute = file.toAbsolutePath().normalize();
    FileTime modified = Files.getLastModifiedTime(absolute);
    CacheKey key = new CacheKey(absolute, modified);

    String cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    String computed = sha256(absolute);
    cache.putIfAbsent(key, computed);
    return computed;
  }

  /** Hash without consulting or filling the cache. */
  public static String sha256(Path file) throws IOException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
    byte[] buffer = new byte[BUFFER_SIZE];
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  public int cacheSize() {
    return cache.size();
  }

  private record CacheKey(Path path, FileTime modified) {}
}
