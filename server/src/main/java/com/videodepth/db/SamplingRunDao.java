package com.videodepth.db;

import com.videodepth.server.sampling.FramePair;
import com.videodepth.server.sampling.FramePairs;
import com.videodepth.util.IntArrayCodec;

import java.sql.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class SamplingRunDao {

    private final String dbPath;

    public SamplingRunDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void upsertRun(String runKey, String flowOps, boolean twoWay, Collection<FramePair> pairs)
            throws SQLException {
        List<FramePair> sorted = FramePairs.sorted(pairs);
        int[] flat = new int[sorted.size() * 2];
        for (int i = 0; i < sorted.size(); i++) {
            flat[2 * i] = sorted.get(i).getFirst();
            flat[2 * i + 1] = sorted.get(i).getSecond();
        }
        byte[] blob = IntArrayCodec.toBytes(flat);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO sampling_run (run_key, flow_ops, two_way, pair_count, pairs_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(run_key) DO UPDATE SET " +
                "flow_ops = excluded.flow_ops, two_way = excluded.two_way, pair_count = excluded.pair_count, " +
                "pairs_blob = excluded.pairs_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runKey);
            ps.setString(2, flowOps);
            ps.setInt(3, twoWay ? 1 : 0);
            ps.setInt(4, sorted.size());
            ps.setBytes(5, blob);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public Optional<List<FramePair>> loadPairs(String runKey) throws SQLException {
        String sql = "SELECT pairs_blob FROM sampling_run WHERE run_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    int[] flat = IntArrayCodec.fromBytes(rs.getBytes("pairs_blob"));
                    if (flat == null) {
                        // zero-length blobs may come back as NULL
                        flat = new int[0];
                    }
                    List<FramePair> pairs = new ArrayList<>(flat.length / 2);
                    for (int i = 0; i + 1 < flat.length; i += 2) {
                        pairs.add(new FramePair(flat[i], flat[i + 1]));
                    }
                    return Optional.of(pairs);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<SamplingRun> findRun(String runKey) throws SQLException {
        String sql = "SELECT id, run_key, flow_ops, two_way, pair_count, created_ts FROM sampling_run " +
                "WHERE run_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SamplingRun(
                            rs.getLong("id"),
                            rs.getString("run_key"),
                            rs.getString("flow_ops"),
                            rs.getInt("two_way") != 0,
                            rs.getInt("pair_count"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }

    public void deleteRun(String runKey) throws SQLException {
        String sql = "DELETE FROM sampling_run WHERE run_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runKey);
            ps.executeUpdate();
        }
    }
}
