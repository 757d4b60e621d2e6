package com.gt.wordreminder.task;

import com.gt.wordreminder.review.ReviewSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class ReviewSessionSweepTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionSweepTask.class);

    private final ReviewSessionService reviewSessionService;
    private final Clock clock;

    @Autowired
    public ReviewSessionSweepTask(ReviewSessionService reviewSessionService, Clock clock) {
        this.reviewSessionService = reviewSessionService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${wordreminder.review.sweepIntervalMillis:600000}")
    public void sweepIdleReviews() {
        int rowsDeleted = reviewSessionService.sweepIdle(clock.instant());

        log.info("Swept idle review sessions. {} row deleted.", rowsDeleted);
    }
}
