package com.paxkun.magpie.service.acquisition;

/**
 * A normalized page: JPEG bytes plus final pixel size. Lives only in memory
 * between acquisition and assembly.
 */
public record EncodedImage(byte[] bytes, int width, int height) {
}
