package com.minutebars.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface MarketBarMapper {
    @Insert("INSERT INTO market_data(symbol, bar_time, trade_date, open_price, high_price, low_price, close_price, volume) " +
            "VALUES(#{symbol}, #{barTime}, #{tradeDate}, #{openPrice}, #{highPrice}, #{lowPrice}, #{closePrice}, #{volume}) " +
            "ON CONFLICT DO NOTHING")
    int insertIfAbsent(MarketBarRow row);

    @Insert({
            "<script>",
            "INSERT INTO market_data(symbol, bar_time, trade_date, open_price, high_price, low_price, close_price, volume) VALUES ",
            "<foreach collection='rows' item='row' separator=','>",
            "(#{row.symbol}, #{row.barTime}, #{row.tradeDate}, #{row.openPrice}, #{row.highPrice}, ",
            "#{row.lowPrice}, #{row.closePrice}, #{row.volume})",
            "</foreach>",
            " ON CONFLICT DO NOTHING",
            "</script>"
    })
    int insertAllIfAbsent(@Param("rows") List<MarketBarRow> rows);

    @Select("SELECT MAX(trade_date) FROM market_data WHERE symbol=#{symbol}")
    LocalDate selectLatestTradeDate(@Param("symbol") String symbol);

    @Select("SELECT COUNT(*) FROM market_data WHERE symbol=#{symbol}")
    long countBars(@Param("symbol") String symbol);

    @Select("SELECT symbol, bar_time, trade_date, open_price, high_price, low_price, close_price, volume " +
            "FROM market_data WHERE symbol=#{symbol} ORDER BY bar_time ASC")
    List<MarketBarRow> selectBars(@Param("symbol") String symbol);
}
