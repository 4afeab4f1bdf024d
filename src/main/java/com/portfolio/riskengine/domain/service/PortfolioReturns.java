package com.portfolio.riskengine.domain.service;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;

public record PortfolioReturns(AssetReturnMatrix assetReturns, ReturnSeries portfolio) {
}
