package com.jz.langid.controller;

import com.jz.langid.common.Result;
import com.jz.langid.config.ClassifyProperties;
import com.jz.langid.domain.dto.BatchDetectRequest;
import com.jz.langid.domain.dto.DetectRequest;
import com.jz.langid.domain.vo.DetectionVO;
import com.jz.langid.service.LanguageDetectService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("api/lang")
@RequiredArgsConstructor
public class LanguageController {
    private final LanguageDetectService detectService;
    private final ClassifyProperties props;

    @PostMapping("/detect")
    public Result<DetectionVO> detect(@RequestBody DetectRequest req) {
        return Result.success(DetectionVO.from(detectService.detect(req.getText())));
    }

    /** 直接传原始代码文本，省得前端转义 */
    @PostMapping(value = "/detect/raw", consumes = MediaType.TEXT_PLAIN_VALUE)
    public Result<DetectionVO> detectRaw(@RequestBody(required = false) String body) {
        return Result.success(DetectionVO.from(detectService.detect(body)));
    }

    @PostMapping("/detect/batch")
    public Result<List<DetectionVO>> detectBatch(@RequestBody BatchDetectRequest req) {
        List<String> texts = req.getTexts() == null ? List.of() : req.getTexts();
        if (texts.size() > props.getBatchMaxSize()) {
            log.warn("batch too large: size={}, max={}", texts.size(), props.getBatchMaxSize());
            return Result.badRequest("batch size " + texts.size() + " exceeds " + props.getBatchMaxSize());
        }
        return Result.success(detectService.detectBatch(texts).stream().map(DetectionVO::from).toList());
    }

    @GetMapping("/labels")
    public Result<List<String>> labels() {
        return Result.success(detectService.labels());
    }
}
