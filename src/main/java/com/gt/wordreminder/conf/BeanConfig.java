package com.gt.wordreminder.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.wordreminder.card.CardDao;
import com.gt.wordreminder.card.impl.CardDaoPG;
import com.gt.wordreminder.preferences.UserPreferencesDao;
import com.gt.wordreminder.preferences.impl.UserPreferencesDaoPG;
import com.gt.wordreminder.quiz.QuizSessionDao;
import com.gt.wordreminder.quiz.impl.QuizSessionDaoPG;
import com.gt.wordreminder.review.ReviewSessionDao;
import com.gt.wordreminder.review.impl.ReviewSessionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.web.client.RestTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

@Configuration
public class BeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${wordreminder.datasource.postgres.url}") String url,
                                    @Value("${wordreminder.datasource.postgres.username}") String username,
                                    @Value("${wordreminder.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public CardDao getCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CardDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewSessionDao getReviewSessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new ReviewSessionDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public QuizSessionDao getQuizSessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new QuizSessionDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public UserPreferencesDao getUserPreferencesDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new UserPreferencesDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random getRandom() {
        return new Random();
    }

    @Bean
    public RestTemplate getRestTemplate(RestTemplateBuilder restTemplateBuilder,
                                        @Value("${wordreminder.telegram.connectTimeoutMillis:5000}") long connectTimeoutMillis,
                                        @Value("${wordreminder.telegram.readTimeoutMillis:30000}") long readTimeoutMillis) {
        return restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMillis))
                .setReadTimeout(Duration.ofMillis(readTimeoutMillis))
                .build();
    }
}
