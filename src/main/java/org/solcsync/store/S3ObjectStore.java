/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;

/**
 * Object store backed by an S3 bucket.
 *
 * <p>Credentials are resolved by the SDK's default provider chain
 * (environment, system properties, profile files, instance metadata).</p>
 */
public class S3ObjectStore implements ObjectStore {

  private static final Logger logger = LoggerFactory.getLogger(
      S3ObjectStore.class);

  private final S3Client s3;

  private final String bucket;

  /** Create a store for the given bucket using the given client. */
  public S3ObjectStore(S3Client s3, String bucket) {
    this.s3 = s3;
    this.bucket = bucket;
  }

  /** Create a store for the given bucket in the given region. */
  public static S3ObjectStore create(String region, String bucket) {
    S3Client client = S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
    logger.debug("Created S3 client for bucket {} in {}.", bucket, region);
    return new S3ObjectStore(client, bucket);
  }

  @Override
  public boolean exists(String key) throws IOException {
    try {
      this.s3.headObject(HeadObjectRequest.builder()
          .bucket(this.bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (404 == e.statusCode()) {
        return false;
      }
      throw new IOException("Cannot check s3://" + this.bucket + "/" + key
          + ": " + e.getMessage(), e);
    } catch (SdkException e) {
      throw new IOException("Cannot check s3://" + this.bucket + "/" + key
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] get(String key) throws IOException {
    try {
      return this.s3.getObjectAsBytes(GetObjectRequest.builder()
          .bucket(this.bucket).key(key).build()).asByteArray();
    } catch (SdkException e) {
      throw new IOException("Cannot get s3://" + this.bucket + "/" + key
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void put(String key, byte[] data, String contentType)
      throws IOException {
    try {
      this.s3.putObject(PutObjectRequest.builder()
          .bucket(this.bucket).key(key).contentType(contentType).build(),
          RequestBody.fromBytes(data));
    } catch (SdkException e) {
      throw new IOException("Cannot put s3://" + this.bucket + "/" + key
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String describe() {
    return "s3://" + this.bucket;
  }

  @Override
  public void close() {
    this.s3.close();
  }
}
