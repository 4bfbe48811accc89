package com.bit.reputation.api;

import com.bit.reputation.common.Pubkey;
import com.bit.reputation.integrity.IntegrityService;
import com.bit.reputation.result.Result;
import com.bit.reputation.structure.dto.DeepIntegrityReport;
import com.bit.reputation.structure.dto.DeepVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationReport;
import com.bit.reputation.structure.dto.IntegrityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/integrity")
public class IntegrityApi {

    @Autowired
    private IntegrityService integrityService;


    /**
     * 基础校验（只比对链头）
     * @param agent Base58编码的agent资产公钥
     */
    @GetMapping("/{agent}")
    public Result<IntegrityReport> verify(@PathVariable String agent) {
        Pubkey key = parseAgent(agent);
        if (key == null) {
            return Result.error(Result.SC_BAD_REQUEST_400, "非法agent地址: " + agent);
        }
        IntegrityReport report = integrityService.verify(key);
        return Result.of(report.isValid(), report.getStatus().getCode(), report);
    }

    /**
     * 抽样校验
     */
    @GetMapping("/{agent}/deep")
    public Result<DeepIntegrityReport> verifyDeep(@PathVariable String agent,
                                                  @RequestParam(required = false) Integer spotChecks,
                                                  @RequestParam(required = false) Boolean checkBoundaries,
                                                  @RequestParam(required = false) Boolean verifyContent) {
        Pubkey key = parseAgent(agent);
        if (key == null) {
            return Result.error(Result.SC_BAD_REQUEST_400, "非法agent地址: " + agent);
        }
        DeepVerificationOptions options = DeepVerificationOptions.builder()
                .spotChecks(spotChecks)
                .checkBoundaries(checkBoundaries)
                .verifyContent(verifyContent)
                .build();
        DeepIntegrityReport report = integrityService.verifyDeep(key, options);
        return Result.of(report.isValid(), report.getStatus().getCode(), report);
    }

    /**
     * 全量重放校验
     */
    @GetMapping("/{agent}/full")
    public Result<FullVerificationReport> verifyFull(@PathVariable String agent,
                                                     @RequestParam(required = false) Integer batchSize,
                                                     @RequestParam(required = false) Boolean useCheckpoints) {
        Pubkey key = parseAgent(agent);
        if (key == null) {
            return Result.error(Result.SC_BAD_REQUEST_400, "非法agent地址: " + agent);
        }
        FullVerificationOptions options = FullVerificationOptions.builder()
                .batchSize(batchSize)
                .useCheckpoints(useCheckpoints)
                .build();
        FullVerificationReport report = integrityService.verifyFull(key, options);
        return Result.of(report.isValid(), report.getStatus().getCode(), report);
    }

    private Pubkey parseAgent(String agent) {
        try {
            return Pubkey.fromBase58(agent);
        } catch (IllegalArgumentException e) {
            log.debug("非法agent地址 {}: {}", agent, e.getMessage());
            return null;
        }
    }

}
