package com.gentoro.flowscript.ir;

import com.gentoro.flowscript.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic identifiers for IR elements.
 *
 * <p>The defining fields are rendered as key-sorted compact JSON (nulls kept) and digested with
 * SHA-256. Equal inputs always produce equal ids, which is what makes identical nodes collapse.
 */
public final class ContentHash {
  private ContentHash() {}

  public static String node(NodeType type, String content, List<Modifier> modifiers) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", type.value());
    fields.put("content", content);
    fields.put("modifiers", modifierValues(modifiers));
    return of(fields);
  }

  public static String block(List<String> childIds, List<Modifier> modifiers) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", NodeType.BLOCK.value());
    fields.put("children", childIds);
    fields.put("modifiers", modifierValues(modifiers));
    return of(fields);
  }

  public static String relationship(
      RelationshipType type, String source, String target, String axisLabel) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", type.value());
    fields.put("source", source);
    fields.put("target", target);
    fields.put("axisLabel", axisLabel);
    return of(fields);
  }

  /** Links added by the linker have no axis component. */
  public static String link(RelationshipType type, String source, String target) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", type.value());
    fields.put("source", source);
    fields.put("target", target);
    return of(fields);
  }

  /** The source line keeps two identical markers apart. */
  public static String state(StateType type, Map<String, String> stateFields, int line) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", type.value());
    fields.put("fields", stateFields);
    fields.put("line", line);
    return of(fields);
  }

  public static String of(Map<String, Object> fields) {
    return sha256(JacksonUtility.toCanonicalJson(fields));
  }

  private static List<String> modifierValues(List<Modifier> modifiers) {
    return modifiers == null ? List.of() : modifiers.stream().map(Modifier::value).toList();
  }

  private static String sha256(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
