package com.my.bridge.adapter.out.discord;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * multipart/form-data 본문 조립기. 파일 업로드가 있는 메시지 전송에만 쓴다.
 */
final class MultipartBody {

    private final String boundary = "bridge-" + UUID.randomUUID();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    MultipartBody json(String name, String json) {
        header("Content-Disposition: form-data; name=\"" + name + "\"", "Content-Type: application/json");
        write(json.getBytes(StandardCharsets.UTF_8));
        write("\r\n");
        return this;
    }

    MultipartBody file(String name, String filename, byte[] data) {
        header("Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + filename.replace("\"", "") + "\"",
                "Content-Type: application/octet-stream");
        write(data);
        write("\r\n");
        return this;
    }

    String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    byte[] build() {
        write("--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private void header(String disposition, String contentType) {
        write("--" + boundary + "\r\n");
        write(disposition + "\r\n");
        write(contentType + "\r\n\r\n");
    }

    private void write(String text) {
        write(text.getBytes(StandardCharsets.UTF_8));
    }

    private void write(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
    }
}
