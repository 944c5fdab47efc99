/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Public keys by signer ID. Thread-safe.
 *
 * <h2>File Format</h2>
 * <p>
 * A key ring may be loaded from a directory of {@code <signerId>.pub} files,
 * each containing the base64 X.509 encoding of a public key (PEM armor
 * lines, if any, are ignored).
 * </p>
 */
public class KeyRing {

  /** Public key file extension (includes the dot). */
  public final static String PUB_EXT = ".pub";

  private final static String[] KEY_ALGOS = { "Ed25519", "EC", "RSA" };


  /**
   * Loads and returns a key ring from the {@code .pub} files in the given
   * directory.
   *
   * @throws UncheckedIOException on I/O error
   * @throws IllegalArgumentException if a key file is malformed
   */
  public static KeyRing load(File dir) {
    if (!dir.isDirectory())
      throw new IllegalArgumentException("not a directory: " + dir);
    var ring = new KeyRing();
    File[] files = dir.listFiles((d, name) -> name.endsWith(PUB_EXT));
    for (var file : files) {
      String name = file.getName();
      String signerId = name.substring(0, name.length() - PUB_EXT.length());
      ring.register(signerId, readKey(file));
    }
    return ring;
  }


  /**
   * Writes the given key to {@code <dir>/<signerId>.pub}.
   *
   * @return the file written
   */
  public static File save(File dir, String signerId, PublicKey key) {
    var file = new File(dir, signerId + PUB_EXT);
    String text =
        "-----BEGIN PUBLIC KEY-----\n" +
        Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
            .encodeToString(key.getEncoded()) +
        "\n-----END PUBLIC KEY-----\n";
    try {
      Files.writeString(file.toPath(), text);
    } catch (IOException iox) {
      throw new UncheckedIOException("on writing " + file, iox);
    }
    return file;
  }


  private static PublicKey readKey(File file) {
    String text;
    try {
      text = Files.readString(file.toPath());
    } catch (IOException iox) {
      throw new UncheckedIOException("on reading " + file, iox);
    }
    var b64 = new StringBuilder();
    for (var line : text.split("\\R")) {
      line = line.strip();
      if (!line.isEmpty() && !line.startsWith("-----"))
        b64.append(line);
    }
    final byte[] encoded;
    try {
      encoded = Base64.getDecoder().decode(b64.toString());
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException("malformed base64 in " + file, iax);
    }
    var spec = new X509EncodedKeySpec(encoded);
    for (var algo : KEY_ALGOS) {
      try {
        return KeyFactory.getInstance(algo).generatePublic(spec);
      } catch (GeneralSecurityException ignore) {
        // try the next algo
      }
    }
    throw new IllegalArgumentException("unrecognized public key in " + file);
  }




  private final Map<String, PublicKey> keys = new ConcurrentHashMap<>();


  /**
   * Registers (or replaces) the public key for the given signer.
   *
   * @return this instance
   */
  public KeyRing register(String signerId, PublicKey key) {
    Objects.requireNonNull(key, "null key");
    if (signerId.isBlank())
      throw new IllegalArgumentException("blank signerId");
    keys.put(signerId, key);
    return this;
  }


  /** Registers the given signer's public key. */
  public KeyRing register(Signer signer) {
    return register(signer.signerId(), signer.publicKey());
  }


  public Optional<PublicKey> publicKey(String signerId) {
    return Optional.ofNullable(keys.get(signerId));
  }


  public boolean contains(String signerId) {
    return keys.containsKey(signerId);
  }


  public SortedSet<String> signerIds() {
    return new TreeSet<>(keys.keySet());
  }


  public boolean isEmpty() {
    return keys.isEmpty();
  }

}
