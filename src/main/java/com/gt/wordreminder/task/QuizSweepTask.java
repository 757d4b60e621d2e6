package com.gt.wordreminder.task;

import com.gt.wordreminder.quiz.QuizSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class QuizSweepTask {

    private static final Logger log = LoggerFactory.getLogger(QuizSweepTask.class);

    private final QuizSessionService quizSessionService;
    private final Clock clock;

    @Autowired
    public QuizSweepTask(QuizSessionService quizSessionService, Clock clock) {
        this.quizSessionService = quizSessionService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${wordreminder.quiz.sweepIntervalMillis:600000}")
    public void sweepExpiredQuizzes() {
        int rowsDeleted = quizSessionService.sweep(clock.instant());

        log.info("Swept expired quiz sessions. {} row deleted.", rowsDeleted);
    }
}
