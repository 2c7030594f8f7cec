package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobPayloadCodec;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.RankingEngine;
import com.example.bookfetch.application.service.RequestStateMachine;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.AudiobookRef;
import com.example.bookfetch.domain.model.RankedCandidate;
import com.example.bookfetch.domain.model.RankingTarget;
import com.example.bookfetch.domain.model.TorrentCandidate;
import com.example.bookfetch.domain.payload.SearchIndexersPayload;
import com.example.bookfetch.infrastructure.client.IndexerClient;
import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.AudiobookMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Searches the indexers, ranks what comes back and hands the best candidate to the download stage.
 * Nothing usable found parks the request in awaiting_search for the retry job.
 */
@Component
public class SearchIndexersProcessor implements JobProcessor<SearchIndexersPayload> {

    private static final Logger log = LoggerFactory.getLogger(SearchIndexersProcessor.class);

    static final String NO_RESULTS_MESSAGE = "No torrents found. Will retry automatically.";

    private final RequestMapper requestMapper;
    private final AudiobookMapper audiobookMapper;
    private final ObjectProvider<IndexerClient> indexerProvider;
    private final RankingEngine rankingEngine;
    private final RequestStateMachine requestStateMachine;
    private final JobQueueService jobQueueService;
    private final JobPayloadCodec payloadCodec;

    public SearchIndexersProcessor(RequestMapper requestMapper,
                                   AudiobookMapper audiobookMapper,
                                   ObjectProvider<IndexerClient> indexerProvider,
                                   RankingEngine rankingEngine,
                                   RequestStateMachine requestStateMachine,
                                   JobQueueService jobQueueService,
                                   JobPayloadCodec payloadCodec) {
        this.requestMapper = requestMapper;
        this.audiobookMapper = audiobookMapper;
        this.indexerProvider = indexerProvider;
        this.rankingEngine = rankingEngine;
        this.requestStateMachine = requestStateMachine;
        this.jobQueueService = jobQueueService;
        this.payloadCodec = payloadCodec;
    }

    @Override
    public JobResult process(SearchIndexersPayload payload) {
        Long requestId = payload.getRequestId();
        AudiobookRef audiobook = payload.getAudiobook();
        if (requestMapper.markSearching(requestId) == 0) {
            log.info("SEARCH_SKIPPED requestId={} currentStatus={}", requestId, requestMapper.selectStatusById(requestId));
            return JobResult.skipped("Request " + requestId + " is no longer searchable");
        }

        IndexerClient indexer = indexerProvider.getIfAvailable();
        if (indexer == null) {
            throw new RetryableJobException("No indexer configured");
        }
        String query = (audiobook.getTitle() + " " + (audiobook.getAuthor() == null ? "" : audiobook.getAuthor())).trim();
        List<TorrentCandidate> results;
        try {
            results = indexer.search(query);
        } catch (IOException e) {
            throw new RetryableJobException("Indexer search failed: " + TextUtil.messageOf(e), e);
        }
        log.info("SEARCH_RESULTS requestId={} query=\"{}\" count={}", requestId, query, results.size());

        if (results.isEmpty()) {
            requestStateMachine.transition(requestId, RequestStatus.AWAITING_SEARCH, NO_RESULTS_MESSAGE);
            return JobResult.skipped("No torrents found, queued for re-search").with("resultsCount", 0);
        }

        List<RankedCandidate> ranked = rankingEngine.rank(results, targetOf(audiobook)).stream()
                .filter(r -> r.getBreakdown().getMatchScore() > 0D)
                .collect(Collectors.toList());
        if (ranked.isEmpty()) {
            requestStateMachine.transition(requestId, RequestStatus.AWAITING_SEARCH,
                    "No matching torrents among " + results.size() + " results. Will retry automatically.");
            return JobResult.skipped("No matching torrents").with("resultsCount", results.size());
        }

        for (RankedCandidate candidate : ranked.subList(0, Math.min(3, ranked.size()))) {
            log.info("SEARCH_RANKED requestId={} rank={} score={} title=\"{}\" notes={}",
                    requestId, candidate.getRank(), Math.round(candidate.getFinalScore()),
                    candidate.getCandidate().getTitle(), candidate.getBreakdown().getNotes());
        }
        RankedCandidate best = ranked.get(0);
        requestMapper.updateSelectedTransfer(requestId, payloadCodec.write(best.getCandidate()));
        if (!requestStateMachine.isActive(requestId)) {
            return JobResult.skipped("Request " + requestId + " was cancelled during search");
        }
        jobQueueService.addDownloadJob(requestId, audiobook, best.getCandidate());

        return JobResult.success("Found " + results.size() + " results, selected best torrent")
                .with("resultsCount", results.size())
                .with("selectedTitle", best.getCandidate().getTitle())
                .with("score", Math.round(best.getFinalScore()));
    }

    private RankingTarget targetOf(AudiobookRef audiobook) {
        Integer durationMinutes = null;
        if (audiobook.getId() != null) {
            AudiobookEntity entity = audiobookMapper.selectById(audiobook.getId());
            durationMinutes = entity == null ? null : entity.getDurationMinutes();
        }
        return new RankingTarget(audiobook.getTitle(), audiobook.getAuthor(), durationMinutes);
    }
}
