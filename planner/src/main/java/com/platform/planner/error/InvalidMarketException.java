package com.platform.planner.error;

/**
 * Raised for an illegal operation on a protected or uninitialized market.
 */
public class InvalidMarketException extends PlannerException {
    
    private final String marketName;
    
    public InvalidMarketException(ErrorCode errorCode, String marketName, String message) {
        super(errorCode, message);
        this.marketName = marketName;
    }
    
    public static InvalidMarketException protectedMarket(String marketName) {
        return new InvalidMarketException(
            ErrorCode.MARKET_PROTECTED,
            marketName,
            String.format("Attempting to delete system market: %s", marketName)
        );
    }
    
    public static InvalidMarketException notInitialized(String marketName) {
        return new InvalidMarketException(
            ErrorCode.MARKET_NOT_INITIALIZED,
            marketName,
            "Market does not exist"
        );
    }
    
    public String getMarketName() {
        return marketName;
    }
}
