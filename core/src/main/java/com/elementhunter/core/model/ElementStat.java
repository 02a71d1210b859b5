package com.elementhunter.core.model;

/**
 * 크롤 전체에서의 태그 통계.
 *
 * @param totalCount 모든 페이지 출현 수 합
 * @param pageCount  등장한 페이지 수
 * @param rarity     1~5 (기본 티어와 출현 비율 하한 중 큰 값)
 */
public record ElementStat(int totalCount, int pageCount, int rarity) {}
