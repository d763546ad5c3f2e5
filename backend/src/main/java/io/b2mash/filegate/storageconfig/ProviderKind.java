package io.b2mash.filegate.storageconfig;

/** Object-store flavours that need different upload handling. */
public enum ProviderKind {
  AWS_S3,
  CLOUDFLARE_R2,
  BACKBLAZE_B2,
  ALIYUN_OSS,
  OTHER
}
