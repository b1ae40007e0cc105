package io.barsync.marketdata.store;

import io.barsync.marketdata.model.Bar;

import java.util.List;

public record Dataset(DatasetInfo info, List<Bar> bars) {
}
