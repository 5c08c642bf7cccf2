package com.stellarcast.media.apod;

import com.stellarcast.common.result.Outcome;

import java.time.LocalDate;

/**
 * Picture-of-the-day source.
 */
public interface ApodClient {

    Outcome<PictureOfDay> fetchToday();

    Outcome<PictureOfDay> fetchByDate(LocalDate date);

    Outcome<PictureOfDay> fetchRandom();
}
