package com.github.spud.sample.alexa.domain.avs;

import lombok.Value;

/**
 * 只含一个 metadata part 的 multipart/form-data 请求体
 */
@Value
public class MultipartEventBody {

  String boundary;
  String body;

  public static MultipartEventBody of(String metadataJson) {
    return of(AvsEventFactory.newId(), metadataJson);
  }

  public static MultipartEventBody of(String boundary, String metadataJson) {
    String body = "--" + boundary + "\r\n"
      + "Content-Disposition: form-data; name=\"metadata\"\r\n"
      + "Content-Type: application/json; charset=UTF-8\r\n\r\n"
      + metadataJson
      + "\r\n--" + boundary + "--";
    return new MultipartEventBody(boundary, body);
  }
}
