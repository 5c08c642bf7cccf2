package com.stellarcast.media.compose;

import com.stellarcast.common.result.Outcome;
import com.stellarcast.media.apod.PictureOfDay;

/**
 * Renders a picture and its explanation into a single image.
 */
public interface ImageComposer {

    /**
     * @return PNG bytes, or a {@code COMPOSE_FAILURE} outcome
     */
    Outcome<byte[]> compose(PictureOfDay picture);
}
