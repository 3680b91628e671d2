package com.autolike.infrastructure.stream;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.exception.RuleSyncException;
import com.autolike.domain.model.FilterRule;
import com.autolike.domain.model.StreamEvent;
import com.autolike.domain.service.EventFilterManager;
import com.autolike.domain.service.FanoutDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.function.IntConsumer;

/**
 * Startup wiring of the pipeline: synchronize the stream rule, then feed every
 * qualifying post into the dispatcher.
 *
 * A failed rule synchronization aborts startup. A rejected stream ends the
 * process with a non-zero status, since nothing useful can run without it.
 */
@Slf4j
@Component
public class FeedRunner implements ApplicationRunner, DisposableBean {

    static final int FEED_FATAL_EXIT_CODE = 2;

    private final EventFilterManager eventFilterManager;
    private final StreamListener streamListener;
    private final FanoutDispatcher fanoutDispatcher;
    private final FeedStatus feedStatus;
    private final FilterRule desiredRule;
    private final IntConsumer exit;

    private volatile Disposable subscription;

    @Autowired
    public FeedRunner(EventFilterManager eventFilterManager,
                      StreamListener streamListener,
                      FanoutDispatcher fanoutDispatcher,
                      FeedStatus feedStatus,
                      AutoLikeProperties properties,
                      ApplicationContext context) {
        this(eventFilterManager, streamListener, fanoutDispatcher, feedStatus, properties,
                code -> new Thread(() -> System.exit(SpringApplication.exit(context, () -> code)),
                        "feed-terminator").start());
    }

    FeedRunner(EventFilterManager eventFilterManager,
               StreamListener streamListener,
               FanoutDispatcher fanoutDispatcher,
               FeedStatus feedStatus,
               AutoLikeProperties properties,
               IntConsumer exit) {
        this.eventFilterManager = eventFilterManager;
        this.streamListener = streamListener;
        this.fanoutDispatcher = fanoutDispatcher;
        this.feedStatus = feedStatus;
        this.desiredRule = FilterRule.authoredBy(
                properties.getTwitter().getSourceUserId(), properties.getTwitter().getRuleTag());
        this.exit = exit;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            eventFilterManager.synchronize(desiredRule);
        } catch (RuleSyncException e) {
            feedStatus.terminated();
            throw e;
        } catch (RuntimeException e) {
            feedStatus.terminated();
            throw new RuleSyncException("Filter rule synchronization failed", e);
        }

        subscription = streamListener.run()
                .subscribe(this::onEvent, this::onFeedError, () -> log.info("Stream closed"));
    }

    private void onEvent(StreamEvent event) {
        log.info("Dispatching post {}", event.getId());
        feedStatus.eventDispatched(event.getId());
        fanoutDispatcher.dispatch(event);
    }

    private void onFeedError(Throwable e) {
        log.error("Stream terminated, shutting down: {}", e.getMessage(), e);
        exit.accept(FEED_FATAL_EXIT_CODE);
    }

    @Override
    public void destroy() {
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            log.info("Closing stream connection");
            current.dispose();
        }
    }
}
