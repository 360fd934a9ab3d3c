package com.termguide.disambiguation.service.vector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Collection persisted to S3 with an in-memory mirror that serves queries. Layout under the
 * configured prefix:
 *
 * <pre>
 *   {prefix}/{collection}/collection.json      tags
 *   {prefix}/{collection}/vectors/{id}.json    one VectorData per vector
 * </pre>
 */
@Slf4j
public class S3VectorIndex extends InMemoryVectorIndex {

  private static final String TAGS_OBJECT = "collection.json";
  private static final String VECTORS_FOLDER = "vectors/";

  private final S3Client s3Client;
  private final ObjectMapper objectMapper;
  private final String bucket;
  private final String collectionKey;

  S3VectorIndex(
      String name, S3Client s3Client, ObjectMapper objectMapper, String bucket, String prefix) {
    super(name);
    this.s3Client = s3Client;
    this.objectMapper = objectMapper;
    this.bucket = bucket;
    this.collectionKey = prefix + "/" + name + "/";
  }

  @Override
  public void upsert(String id, List<Float> vector, Map<String, String> metadata, String document) {
    super.upsert(id, vector, metadata, document);
    putJson(vectorKey(id), get(id));
  }

  @Override
  public void putTag(String key, String value) {
    super.putTag(key, value);
    putJson(collectionKey + TAGS_OBJECT, getTags());
  }

  @Override
  public void clear() {
    super.clear();
    deletePersisted();
  }

  /** Deletes the stored objects while leaving the in-memory mirror readable. */
  void deletePersisted() {
    int deleted = 0;
    for (String key : listKeys(collectionKey)) {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      deleted++;
    }
    log.info("Deleted {} objects of collection {} from s3://{}", deleted, getName(), bucket);
  }

  /** Fills the mirror from S3. Returns false when the collection has no tags object. */
  @SuppressWarnings("unchecked")
  boolean reload() {
    try {
      byte[] tagBytes =
          s3Client
              .getObjectAsBytes(
                  GetObjectRequest.builder()
                      .bucket(bucket)
                      .key(collectionKey + TAGS_OBJECT)
                      .build())
              .asByteArray();
      Map<String, String> tags = objectMapper.readValue(tagBytes, Map.class);
      tags.forEach(super::putTag);
    } catch (NoSuchKeyException e) {
      log.debug("Collection {} has no tags object", getName());
      return false;
    } catch (IOException e) {
      throw new IllegalStateException("Unreadable tags for collection " + getName(), e);
    }

    int loaded = 0;
    for (String key : listKeys(collectionKey + VECTORS_FOLDER)) {
      if (!key.endsWith(".json")) {
        continue;
      }
      try {
        byte[] data =
            s3Client
                .getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
                .asByteArray();
        store(objectMapper.readValue(data, VectorData.class));
        loaded++;
      } catch (IOException e) {
        log.warn("Skipping unreadable vector object {}: {}", key, e.getMessage());
      }
    }
    log.info("Reloaded {} vectors of collection {} from s3://{}", loaded, getName(), bucket);
    return true;
  }

  private List<String> listKeys(String prefix) {
    List<String> keys = new ArrayList<>();
    String continuationToken = null;
    do {
      ListObjectsV2Request.Builder request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
      if (continuationToken != null) {
        request.continuationToken(continuationToken);
      }
      ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
      for (S3Object object : response.contents()) {
        keys.add(object.key());
      }
      continuationToken = response.nextContinuationToken();
    } while (continuationToken != null);
    return keys;
  }

  private void putJson(String key, Object value) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType("application/json")
              .build(),
          RequestBody.fromString(objectMapper.writeValueAsString(value)));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize " + key, e);
    }
  }

  private String vectorKey(String id) {
    return collectionKey + VECTORS_FOLDER + sanitizeForS3Key(id) + ".json";
  }

  static String sanitizeForS3Key(String id) {
    return id.replace("/", "_SLASH_")
        .replace("\\", "_BACKSLASH_")
        .replace(":", "_COLON_")
        .replace("*", "_STAR_")
        .replace("?", "_QUESTION_")
        .replace("\"", "_QUOTE_")
        .replace("<", "_LT_")
        .replace(">", "_GT_")
        .replace("|", "_PIPE_")
        .replace(" ", "_");
  }
}
