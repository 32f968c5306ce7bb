package com.conduit.grpc.resolver;

import javax.naming.NameNotFoundException;
import javax.naming.NamingException;
import java.net.InetAddress;
import java.util.List;

/**
 * The two DNS queries behind an SRV target. A name that does not exist is reported as
 * {@link NameNotFoundException}; any other {@link NamingException} is a failed lookup worth retrying.
 */
interface DnsLookup {

    /** SRV records of {@code _<service>._tcp.<domain>}, in answer order. */
    List<SrvRecord> srv(String service, String domain) throws NamingException;

    /** Addresses of a host named by an SRV record. */
    List<InetAddress> host(String name) throws NamingException;

    /**
     * @param port   port the backend listens on
     * @param target backend host name, without the trailing root dot
     */
    record SrvRecord(int port, String target) {

        /**
         * Parses the presentation form {@code <priority> <weight> <port> <target>}.
         *
         * @throws IllegalArgumentException if the record does not have four fields or a numeric port
         */
        static SrvRecord parse(String record) {
            String[] fields = record.trim().split("\\s+");
            if (fields.length != 4) {
                throw new IllegalArgumentException("malformed SRV record \"%s\"".formatted(record));
            }
            String target = fields[3].endsWith(".") ? fields[3].substring(0, fields[3].length() - 1) : fields[3];
            return new SrvRecord(Integer.parseInt(fields[2]), target);
        }
    }
}
