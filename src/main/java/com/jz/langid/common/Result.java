package com.jz.langid.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class Result<T> {
    private Integer code;
    private String message;
    private T data;

    public static <T> Result<T> success(T data) {
        return of(200, "success", data);
    }

    /** 调用方输入有问题（空文本、批量过大等） */
    public static <T> Result<T> badRequest(String msg) {
        return of(400, msg, null);
    }

    public static <T> Result<T> error(String msg) {
        return of(500, msg, null);
    }
}
