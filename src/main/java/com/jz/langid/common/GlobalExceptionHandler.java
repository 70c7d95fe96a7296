package com.jz.langid.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** 统一把识别异常包成 Result，HTTP 状态保持 200，业务码放在 code 里 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EmptyInputException.class)
    public Result<Void> onEmptyInput(EmptyInputException e) {
        log.warn("rejected empty input: {}", e.getMessage());
        return Result.badRequest(e.getMessage());
    }

    @ExceptionHandler({MalformedModelException.class, UnknownLabelException.class})
    public Result<Void> onModelDefect(LanguageDetectionException e) {
        log.error("language model defect: {}", e.getMessage(), e);
        return Result.error("language model unavailable");
    }

    /** 兜底：线程池打满等其它异常也保持 Result 结构 */
    @ExceptionHandler(Exception.class)
    public Result<Void> onUnexpected(Exception e) {
        log.error("unexpected error: {}", e.toString(), e);
        return Result.error("internal error");
    }
}
