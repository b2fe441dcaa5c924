package com.gridtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** A sampled mark price with its UTC timestamp. */
public record PricePoint(BigDecimal price, LocalDateTime timestamp) {}
