package com.conduit.grpc.resolver;

import com.google.common.net.InetAddresses;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

/**
 * {@link DnsLookup} through the JDK's JNDI DNS provider. Without an authority, host names go
 * through the system resolver like any other connection the process makes.
 */
final class JndiDnsLookup implements DnsLookup {

    private static final String DNS_CONTEXT_FACTORY = "com.sun.jndi.dns.DnsContextFactory";

    private final String authority;

    /**
     * @param authority {@code host[:port]} of the DNS server to query, or null for the system's
     */
    JndiDnsLookup(String authority) {
        this.authority = authority;
    }

    @Override
    public List<SrvRecord> srv(String service, String domain) throws NamingException {
        List<SrvRecord> records = new ArrayList<>();
        for (String value : query("_" + service + "._tcp." + domain, "SRV")) {
            try {
                records.add(SrvRecord.parse(value));
            } catch (IllegalArgumentException e) {
                NamingException malformed = new NamingException(e.getMessage());
                malformed.setRootCause(e);
                throw malformed;
            }
        }
        return records;
    }

    @Override
    public List<InetAddress> host(String name) throws NamingException {
        if (authority == null) {
            try {
                return List.of(InetAddress.getAllByName(name));
            } catch (UnknownHostException e) {
                NameNotFoundException missing = new NameNotFoundException(name);
                missing.setRootCause(e);
                throw missing;
            }
        }
        List<InetAddress> addresses = new ArrayList<>();
        for (String value : query(name, "A", "AAAA")) {
            if (!InetAddresses.isInetAddress(value)) {
                throw new NamingException("srv: error parsing address record %s of %s".formatted(value, name));
            }
            addresses.add(InetAddresses.forString(value));
        }
        return addresses;
    }

    private List<String> query(String name, String... types) throws NamingException {
        DirContext context = new InitialDirContext(environment());
        try {
            Attributes attributes = context.getAttributes(name, types);
            List<String> values = new ArrayList<>();
            for (String type : types) {
                Attribute attribute = attributes.get(type);
                if (attribute == null) {
                    continue;
                }
                NamingEnumeration<?> all = attribute.getAll();
                while (all.hasMore()) {
                    values.add(String.valueOf(all.next()));
                }
            }
            return values;
        } finally {
            context.close();
        }
    }

    private Hashtable<String, String> environment() {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, DNS_CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, authority == null ? "dns:" : "dns://" + authority);
        return env;
    }
}
