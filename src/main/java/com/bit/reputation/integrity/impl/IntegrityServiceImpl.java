package com.bit.reputation.integrity.impl;

import com.bit.reputation.chain.ChainException;
import com.bit.reputation.chain.ChainReplayer;
import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.SealHasher;
import com.bit.reputation.common.Digest;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.config.IntegrityConfig;
import com.bit.reputation.integrity.IntegrityService;
import com.bit.reputation.integrity.ObservedCountTracker;
import com.bit.reputation.integrity.SpotCheckSampler;
import com.bit.reputation.integrity.VerifiedCheckpointStore;
import com.bit.reputation.source.IndexerSource;
import com.bit.reputation.source.OnChainRegistry;
import com.bit.reputation.source.SourceException;
import com.bit.reputation.structure.chain.AgentChains;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.chain.CheckpointSet;
import com.bit.reputation.structure.chain.ReplayPage;
import com.bit.reputation.structure.dto.ChainIntegrity;
import com.bit.reputation.structure.dto.ChainReplayReport;
import com.bit.reputation.structure.dto.DeepIntegrityReport;
import com.bit.reputation.structure.dto.DeepVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationReport;
import com.bit.reputation.structure.dto.IntegrityReport;
import com.bit.reputation.structure.dto.IntegrityStatus;
import com.bit.reputation.structure.dto.ReplayResult;
import com.bit.reputation.structure.dto.SpotCheckResult;
import com.bit.reputation.structure.event.ChainEvent;
import com.bit.reputation.structure.event.FeedbackEvent;
import com.bit.reputation.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 完整性校验编排
 * <p>
 * 链上状态是唯一可信来源，索引器返回的一切都要与之比对。
 * 所有远程调用都提交到 integrity-io 线程池，并受 fetchTimeoutMs 限制。
 */
@Slf4j
@Service
public class IntegrityServiceImpl implements IntegrityService {

    static final String AGENT_NOT_FOUND = "agent not found on-chain";

    private final OnChainRegistry registry;
    private final IndexerSource indexer;
    private final ChainReplayer replayer;
    private final IntegrityConfig config;
    private final ExecutorService executor;
    private final SpotCheckSampler sampler;
    private final ObservedCountTracker countTracker;
    private final VerifiedCheckpointStore checkpointStore;

    public IntegrityServiceImpl(OnChainRegistry registry,
                                IndexerSource indexer,
                                ChainReplayer replayer,
                                IntegrityConfig config,
                                @Qualifier("integrityExecutor") ExecutorService executor,
                                SpotCheckSampler sampler,
                                ObservedCountTracker countTracker,
                                VerifiedCheckpointStore checkpointStore) {
        this.registry = registry;
        this.indexer = indexer;
        this.replayer = replayer;
        this.config = config;
        this.executor = executor;
        this.sampler = sampler;
        this.countTracker = countTracker;
        this.checkpointStore = checkpointStore;
    }

    // ========== 基础校验 ==========

    @Override
    public IntegrityReport verify(Pubkey agent) {
        long startTime = System.currentTimeMillis();
        IntegrityReport report = new IntegrityReport();
        report.setAgent(agent.toBase58());
        report.applyStatus(compare(agent, report));
        report.setDurationMs(System.currentTimeMillis() - startTime);
        log.info("基础校验 agent={} status={} totalLag={} 耗时{}ms",
                report.getAgent(), report.getStatus().getCode(), report.getTotalLag(), report.getDurationMs());
        return report;
    }

    /**
     * 并发读取链上与索引器的 (digest, count) 并逐链比对，结果写入report
     * @return 基础比对得出的状态，I/O失败时为ERROR（错误信息写入report）
     */
    private IntegrityStatus compare(Pubkey agent, IntegrityReport report) {
        try {
            CompletableFuture<Optional<AgentChains>> onChainFuture = async(() -> registry.fetchAgentChains(agent));
            Map<ChainType, CompletableFuture<ChainState>> indexerFutures = new EnumMap<>(ChainType.class);
            for (ChainType chainType : ChainType.values()) {
                indexerFutures.put(chainType, async(() -> indexer.lastDigest(agent, chainType)));
            }

            Optional<AgentChains> onChain = await(onChainFuture, "读取链上状态");
            if (onChain.isEmpty()) {
                report.setError(AGENT_NOT_FOUND);
                return IntegrityStatus.ERROR;
            }
            String regression = checkRegression(agent, onChain.get());
            if (regression != null) {
                report.setError(regression);
                return IntegrityStatus.ERROR;
            }

            IntegrityStatus status = IntegrityStatus.VALID;
            long totalLag = 0;
            for (ChainType chainType : ChainType.values()) {
                ChainState expected = onChain.get().get(chainType);
                ChainState claimed = await(indexerFutures.get(chainType), "读取索引器" + chainType.getCode() + "链摘要");
                ChainIntegrity chain = ChainIntegrity.builder()
                        .chainType(chainType)
                        .onChainDigest(expected.getDigest().toHex())
                        .indexerDigest(claimed.getDigest().toHex())
                        .countOnChain(expected.getCount())
                        .countIndexer(claimed.getCount())
                        .lag(expected.getCount() - claimed.getCount())
                        .digestMatch(expected.getCount() == claimed.getCount()
                                && expected.getDigest().equals(claimed.getDigest()))
                        .build();
                report.getChains().put(chainType, chain);

                IntegrityStatus chainStatus;
                if (chain.getLag() < 0) {
                    // 索引器比链上还多，不可能是同步延迟
                    log.warn("agent {} {}链索引器计数{}超过链上计数{}",
                            agent, chainType.getCode(), claimed.getCount(), expected.getCount());
                    chainStatus = IntegrityStatus.CORRUPTED;
                } else if (chain.getLag() == 0 && !chain.isDigestMatch()) {
                    log.warn("agent {} {}链计数相同但摘要不同: 链上{} 索引器{}",
                            agent, chainType.getCode(), chain.getOnChainDigest(), chain.getIndexerDigest());
                    chainStatus = IntegrityStatus.CORRUPTED;
                } else if (chain.getLag() > 0) {
                    chainStatus = IntegrityStatus.SYNCING;
                    totalLag += chain.getLag();
                } else {
                    chainStatus = IntegrityStatus.VALID;
                }
                status = worst(status, chainStatus);
            }
            report.setTotalLag(totalLag);
            return status;
        } catch (RuntimeException e) {
            log.warn("agent {} 基础比对失败: {}", agent, e.getMessage());
            report.setError(e.getMessage());
            return IntegrityStatus.ERROR;
        }
    }

    // ========== 抽样校验 ==========

    @Override
    public DeepIntegrityReport verifyDeep(Pubkey agent, DeepVerificationOptions options) {
        long startTime = System.currentTimeMillis();
        int spotChecks = options != null && options.getSpotChecks() != null
                ? options.getSpotChecks() : config.getDeep().getSpotChecks();
        boolean checkBoundaries = options != null && options.getCheckBoundaries() != null
                ? options.getCheckBoundaries() : config.getDeep().isCheckBoundaries();
        boolean verifyContent = options != null && options.getVerifyContent() != null
                ? options.getVerifyContent() : config.getDeep().isVerifyContent();

        DeepIntegrityReport report = new DeepIntegrityReport();
        report.setAgent(agent.toBase58());
        IntegrityStatus basic = compare(agent, report);
        if (basic == IntegrityStatus.ERROR) {
            report.setMissingItems(-1);
            report.setSpotChecksPassed(false);
            finish(report, IntegrityStatus.ERROR, startTime);
            return report;
        }

        Map<ChainType, List<Long>> sampled = new EnumMap<>(ChainType.class);
        Map<ChainType, CompletableFuture<Map<Long, ChainEvent>>> fetches = new EnumMap<>(ChainType.class);
        for (ChainType chainType : ChainType.values()) {
            long count = report.chain(chainType).getCountIndexer();
            List<Long> positions = sampler.sample(count, spotChecks, checkBoundaries);
            if (positions.isEmpty()) {
                continue;
            }
            sampled.put(chainType, positions);
            fetches.put(chainType, async(() -> indexer.eventsAt(agent, chainType, positions)));
        }

        int missing = 0;
        int modified = 0;
        try {
            for (Map.Entry<ChainType, List<Long>> entry : sampled.entrySet()) {
                ChainType chainType = entry.getKey();
                Map<Long, ChainEvent> found = await(fetches.get(chainType), "抽检" + chainType.getCode() + "链");
                ChainIntegrity chain = report.chain(chainType);
                for (Long position : entry.getValue()) {
                    ChainEvent event = found.get(position);
                    if (event == null) {
                        missing++;
                        report.spotChecks(chainType).add(SpotCheckResult.missing(position));
                        log.warn("agent {} {}链位置{}的记录缺失", agent, chainType.getCode(), position);
                        continue;
                    }
                    SpotCheckResult result = SpotCheckResult.builder().index(position).exists(true).build();
                    if (verifyContent && event instanceof FeedbackEvent) {
                        checkContent((FeedbackEvent) event, result);
                    }
                    if (position == chain.getCountIndexer() - 1 && event.getStoredDigest() != null
                            && !ByteUtils.bytesToHex(event.getStoredDigest()).equals(chain.getIndexerDigest())) {
                        // 最后一条记录的摘要必须与索引器报告的链头一致
                        result.setContentValid(false);
                        result.setContentError("stored_digest_mismatch");
                    }
                    if (Boolean.FALSE.equals(result.getContentValid())) {
                        modified++;
                        log.warn("agent {} {}链位置{}的记录被修改: {}",
                                agent, chainType.getCode(), position, result.getContentError());
                    }
                    report.spotChecks(chainType).add(result);
                }
            }
        } catch (RuntimeException e) {
            log.warn("agent {} 抽检失败: {}", agent, e.getMessage());
            report.setError(e.getMessage());
            report.setMissingItems(-1);
            report.setModifiedItems(modified);
            report.setSpotChecksPassed(false);
            finish(report, IntegrityStatus.ERROR, startTime);
            return report;
        }

        report.setMissingItems(missing);
        report.setModifiedItems(modified);
        report.setSpotChecksPassed(missing == 0 && modified == 0);
        IntegrityStatus status = report.isSpotChecksPassed() ? basic : IntegrityStatus.CORRUPTED;
        finish(report, status, startTime);
        return report;
    }

    /**
     * 用记录附带的内容重新计算SEAL哈希
     */
    private void checkContent(FeedbackEvent event, SpotCheckResult result) {
        if (event.getContent() == null) {
            result.setContentError("no_content");
            return;
        }
        try {
            boolean matches = SealHasher.verifySealHash(event.getContent(), event.getSealHash());
            result.setContentValid(matches);
            if (!matches) {
                result.setContentError("seal_hash_mismatch");
            }
        } catch (ChainException e) {
            result.setContentValid(false);
            result.setContentError(e.getMessage());
        }
    }

    private void finish(DeepIntegrityReport report, IntegrityStatus status, long startTime) {
        report.applyStatus(status);
        report.setDurationMs(System.currentTimeMillis() - startTime);
        log.info("抽样校验 agent={} status={} 缺失{} 修改{} 耗时{}ms", report.getAgent(), status.getCode(),
                report.getMissingItems(), report.getModifiedItems(), report.getDurationMs());
    }

    // ========== 全量校验 ==========

    @Override
    public FullVerificationReport verifyFull(Pubkey agent, FullVerificationOptions options) {
        long startTime = System.currentTimeMillis();
        int batchSize = options != null && options.getBatchSize() != null
                ? options.getBatchSize() : config.getFull().getBatchSize();
        boolean useCheckpoints = options != null && options.getUseCheckpoints() != null
                ? options.getUseCheckpoints() : config.getFull().isUseCheckpoints();
        FullVerificationOptions.ProgressListener listener = options == null ? null : options.getOnProgress();

        FullVerificationReport report = new FullVerificationReport();
        report.setAgent(agent.toBase58());
        IntegrityStatus status;
        try {
            status = replayAll(agent, Math.max(1, batchSize), useCheckpoints, listener, report);
        } catch (RuntimeException e) {
            log.warn("agent {} 全量校验失败: {}", agent, e.getMessage());
            report.setError(e.getMessage());
            status = IntegrityStatus.ERROR;
        }
        report.applyStatus(status);

        if (status == IntegrityStatus.VALID) {
            for (ChainReplayReport chain : report.getChains().values()) {
                checkpointStore.put(agent, chain.getChainType(),
                        ChainState.of(Digest.fromHex(chain.getComputedDigest()),
                                chain.getComputedCount()));
            }
        }
        report.setDurationMs(System.currentTimeMillis() - startTime);
        log.info("全量校验 agent={} status={} totalLag={} 使用检查点={} 耗时{}ms", report.getAgent(),
                status.getCode(), report.getTotalLag(), report.isCheckpointsUsed(), report.getDurationMs());
        return report;
    }

    private IntegrityStatus replayAll(Pubkey agent, int batchSize, boolean useCheckpoints,
                                      FullVerificationOptions.ProgressListener listener,
                                      FullVerificationReport report) {
        CompletableFuture<Optional<AgentChains>> onChainFuture = async(() -> registry.fetchAgentChains(agent));
        CompletableFuture<CheckpointSet> checkpointFuture = useCheckpoints
                ? async(() -> indexer.latestCheckpoints(agent))
                : CompletableFuture.completedFuture(CheckpointSet.empty());

        Optional<AgentChains> onChain = await(onChainFuture, "读取链上状态");
        if (onChain.isEmpty()) {
            checkpointFuture.cancel(true);
            report.setError(AGENT_NOT_FOUND);
            return IntegrityStatus.ERROR;
        }
        String regression = checkRegression(agent, onChain.get());
        if (regression != null) {
            checkpointFuture.cancel(true);
            report.setError(regression);
            return IntegrityStatus.ERROR;
        }

        CheckpointSet indexerCheckpoints;
        try {
            indexerCheckpoints = await(checkpointFuture, "读取索引器检查点");
        } catch (SourceException e) {
            // 索引器检查点只是加速手段，取不到就从本地检查点或创世状态开始
            log.warn("agent {} 索引器检查点不可用，忽略: {}", agent, e.getMessage());
            indexerCheckpoints = CheckpointSet.empty();
        }

        IntegrityStatus status = IntegrityStatus.VALID;
        long totalLag = 0;
        for (ChainType chainType : ChainType.values()) {
            ChainState expected = onChain.get().get(chainType);
            // 不使用检查点时本地已验证检查点也不参与，从创世状态完整重放
            Optional<ChainState> local = useCheckpoints ? checkpointStore.get(agent, chainType) : Optional.empty();
            if (local.isPresent() && local.get().getCount() > expected.getCount()) {
                report.setError(chainType.getCode() + "链本地已验证检查点(" + local.get().getCount()
                        + ")超过链上计数(" + expected.getCount() + ")");
                return IntegrityStatus.ERROR;
            }
            ChainState start = chooseStart(local, indexerCheckpoints.get(chainType), expected);
            if (start.getCount() > 0) {
                report.setCheckpointsUsed(true);
            }

            ChainReplayReport chain = replayChain(agent, chainType, start, expected, batchSize, listener);
            report.getChains().put(chainType, chain);

            IntegrityStatus chainStatus;
            if (!chain.isValid()) {
                chainStatus = IntegrityStatus.CORRUPTED;
            } else if (chain.getComputedCount() > expected.getCount()) {
                chainStatus = IntegrityStatus.CORRUPTED;
            } else if (chain.getComputedCount() == expected.getCount() && !chain.isMatch()) {
                log.warn("agent {} {}链重放摘要{}与链上摘要{}不一致", agent, chainType.getCode(),
                        chain.getComputedDigest(), chain.getExpectedDigest());
                chainStatus = IntegrityStatus.CORRUPTED;
            } else if (chain.getComputedCount() < expected.getCount()) {
                chainStatus = IntegrityStatus.SYNCING;
                totalLag += chain.getLag();
            } else {
                chainStatus = IntegrityStatus.VALID;
            }
            status = worst(status, chainStatus);
        }
        report.setTotalLag(totalLag);
        return status;
    }

    /**
     * 选计数最大且不超过链上计数的检查点
     */
    private ChainState chooseStart(Optional<ChainState> local, Optional<ChainState> fromIndexer, ChainState expected) {
        ChainState start = ChainState.GENESIS;
        if (local.isPresent()) {
            start = local.get();
        }
        if (fromIndexer.isPresent()
                && fromIndexer.get().getCount() <= expected.getCount()
                && fromIndexer.get().getCount() > start.getCount()) {
            start = fromIndexer.get();
        }
        return start;
    }

    private ChainReplayReport replayChain(Pubkey agent, ChainType chainType, ChainState start, ChainState expected,
                                          int batchSize, FullVerificationOptions.ProgressListener listener) {
        ChainState state = start;
        long fromCount = start.getCount();
        ReplayResult last = ReplayResult.valid(start.getDigest(), start.getCount());
        Long mismatchAt = null;

        while (true) {
            long from = fromCount;
            ReplayPage page = await(async(() -> indexer.replayPage(agent, chainType, from, batchSize)),
                    "读取" + chainType.getCode() + "链事件(from=" + from + ")");
            last = replayer.replay(chainType, page.getEvents(), state);
            if (!last.isValid()) {
                mismatchAt = state.getCount() + last.getMismatchAt();
                state = last.toState();
                break;
            }
            state = last.toState();
            if (listener != null) {
                listener.onProgress(chainType, state.getCount(), expected.getCount());
            }
            if (!page.isHasMore()) {
                break;
            }
            if (page.getNextFromCount() <= fromCount) {
                throw new SourceException(chainType.getCode() + "链分页未推进(nextFromCount=" + page.getNextFromCount() + ")");
            }
            fromCount = page.getNextFromCount();
        }

        ChainReplayReport chain = new ChainReplayReport();
        chain.setChainType(chainType);
        chain.setValid(last.isValid());
        chain.setStartCount(start.getCount());
        chain.setComputedDigest(state.getDigest().toHex());
        chain.setComputedCount(state.getCount());
        chain.setExpectedDigest(expected.getDigest().toHex());
        chain.setExpectedCount(expected.getCount());
        chain.setLag(expected.getCount() - state.getCount());
        chain.setMismatchAt(mismatchAt);
        chain.setMatch(last.isValid() && state.equals(expected));
        log.debug("agent {} {}链重放: 起点{} 计算{}条 链上{}条 match={}", agent, chainType.getCode(),
                start.getCount(), state.getCount(), expected.getCount(), chain.isMatch());
        return chain;
    }

    // ========== 公共 ==========

    /**
     * @return 有链计数回退时返回错误描述，否则null
     */
    private String checkRegression(Pubkey agent, AgentChains onChain) {
        String error = null;
        for (ChainType chainType : ChainType.values()) {
            long count = onChain.get(chainType).getCount();
            if (!countTracker.observe(agent, chainType, count) && error == null) {
                error = chainType.getCode() + "链链上计数回退到" + count
                        + "（之前观测到" + countTracker.highest(agent, chainType) + "）";
            }
        }
        return error;
    }

    // 状态枚举按严重程度升序声明
    private static IntegrityStatus worst(IntegrityStatus a, IntegrityStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executor);
    }

    private <T> T await(Future<T> future, String action) {
        try {
            return future.get(config.getFetchTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceException(action + "超时(" + config.getFetchTimeoutMs() + "ms)", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new SourceException(action + "失败: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(action + "被中断", e);
        }
    }
}
