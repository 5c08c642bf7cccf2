package com.stellarcast.gateway.support;

import com.stellarcast.common.result.ErrorKind;
import com.stellarcast.common.result.Outcome;
import com.stellarcast.media.apod.ApodClient;
import com.stellarcast.media.apod.PictureOfDay;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * APOD client returning canned outcomes and counting calls.
 */
public class FakeApodClient implements ApodClient {

    public volatile Outcome<PictureOfDay> today = Outcome.ok(image("2024-03-10"));
    public volatile Outcome<PictureOfDay> random = Outcome.ok(image("2001-01-01"));
    public volatile Outcome<PictureOfDay> byDate = Outcome.ok(image("2023-10-01"));

    public final AtomicInteger todayCalls = new AtomicInteger();
    public final AtomicInteger randomCalls = new AtomicInteger();
    public final AtomicInteger byDateCalls = new AtomicInteger();
    public volatile LocalDate lastDate;

    @Override
    public Outcome<PictureOfDay> fetchToday() {
        todayCalls.incrementAndGet();
        return today;
    }

    @Override
    public Outcome<PictureOfDay> fetchByDate(LocalDate date) {
        byDateCalls.incrementAndGet();
        lastDate = date;
        return byDate;
    }

    @Override
    public Outcome<PictureOfDay> fetchRandom() {
        randomCalls.incrementAndGet();
        return random;
    }

    public static PictureOfDay image(String date) {
        return PictureOfDay.builder()
                .title("Picture " + date)
                .explanation("Explanation for " + date)
                .date(date)
                .mediaType(PictureOfDay.MEDIA_IMAGE)
                .url("https://apod.nasa.gov/" + date + ".jpg")
                .hdurl("https://apod.nasa.gov/" + date + "_hd.jpg")
                .build();
    }

    public static PictureOfDay video(String date) {
        return PictureOfDay.builder()
                .title("Video " + date)
                .date(date)
                .mediaType(PictureOfDay.MEDIA_VIDEO)
                .url("https://www.youtube.com/embed/" + date)
                .build();
    }

    public static Outcome<PictureOfDay> unavailable() {
        return Outcome.failed(ErrorKind.FETCH_FAILURE, "APOD status 503");
    }
}
