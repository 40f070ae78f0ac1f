package com.example.paging.model;

/**
 * Lifecycle status of a paginator.
 *
 * <ul>
 *   <li>{@link #IDLE}: nothing loaded yet, or just reset by {@code loadInitial()}/{@code refresh()}</li>
 *   <li>{@link #LOADING}: a next page is being fetched; existing items stay visible</li>
 *   <li>{@link #READY}: the last load succeeded</li>
 *   <li>{@link #ERROR}: the last load failed; existing items stay visible</li>
 * </ul>
 */
public enum PageStatus {
    IDLE,
    LOADING,
    READY,
    ERROR
}
